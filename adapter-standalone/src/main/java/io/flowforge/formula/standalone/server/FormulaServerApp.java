package io.flowforge.formula.standalone.server;

import io.flowforge.formula.core.function.FunctionRegistry;
import io.flowforge.formula.core.service.ExpressionService;
import io.flowforge.formula.standalone.config.ConfigLoader;
import io.flowforge.formula.standalone.config.ServerConfig;
import io.javalin.Javalin;
import io.javalin.http.HandlerType;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts the formula HTTP server.
 *
 * <p>Lifecycle:
 * <ol>
 * <li>Load configuration from YAML plus environment overrides</li>
 * <li>Configure Logback from {@code logging.format} and {@code logging.level}</li>
 * <li>Build the expression service with the configured limits</li>
 * <li>Register routes and start Javalin</li>
 * </ol>
 *
 * <p>Kept apart from {@link io.flowforge.formula.standalone.StandaloneMain} so tests can start
 * and stop servers without going through {@code main()}.
 */
public final class FormulaServerApp {

    private static final Logger LOG = LoggerFactory.getLogger(FormulaServerApp.class);

    static final String API_BASE = "/api/expressions";

    private final Javalin app;
    private final ExpressionService service;
    private final ServerConfig config;

    private FormulaServerApp(Javalin app, ExpressionService service, ServerConfig config) {
        this.app = app;
        this.service = service;
        this.config = config;
    }

    /**
     * Loads configuration from the command line and starts the server.
     *
     * @param args command-line arguments, e.g. {@code --config path/to/config.yaml}
     * @throws io.flowforge.formula.standalone.config.ConfigLoadException if configuration fails
     */
    public static FormulaServerApp start(String[] args) {
        Path configPath = ConfigLoader.resolveConfigPath(args);
        ServerConfig config = ConfigLoader.load(configPath);
        LogbackConfigurator.configure(config);
        LOG.info("Configuration loaded from {}", configPath);
        return start(config);
    }

    /** Starts the server with an already loaded configuration. */
    public static FormulaServerApp start(ServerConfig config) {
        long startTime = System.nanoTime();

        ExpressionService service = new ExpressionService(FunctionRegistry.standard(), config.limits());

        Javalin app = Javalin.create(javalinConfig -> {
            javalinConfig.http.maxRequestSize = config.maxBodyBytes();
        });

        app.exception(RequestRejectedException.class, (e, ctx) -> {
            ctx.status(e.status());
            ctx.contentType("application/problem+json");
            ctx.result(e.problem().toString());
        });
        app.exception(Exception.class, (e, ctx) -> {
            LOG.error("Unhandled error: method={}, path={}", ctx.method(), ctx.path(), e);
            ctx.status(500);
            ctx.contentType("application/problem+json");
            ctx.result(ProblemDetail.internalError("Unexpected server error", ctx.path()).toString());
        });

        if (config.healthEnabled()) {
            app.get(config.healthPath(), new HealthHandler());
        }

        int maxBody = config.maxBodyBytes();
        app.addHttpHandler(HandlerType.POST, API_BASE + "/evaluate", new EvaluateHandler(service, maxBody));
        app.addHttpHandler(HandlerType.POST, API_BASE + "/evaluate/batch", new BatchEvaluateHandler(service, maxBody));
        app.addHttpHandler(HandlerType.POST, API_BASE + "/validate", new ValidateHandler(service, maxBody));
        app.addHttpHandler(HandlerType.POST, API_BASE + "/parse", new ParseHandler(service, maxBody));
        app.addHttpHandler(HandlerType.POST, API_BASE + "/tokenize", new TokenizeHandler(service, maxBody));
        app.addHttpHandler(HandlerType.POST, API_BASE + "/suggestions", new SuggestionsHandler(service, maxBody));

        // Fixed paths first: {name} would otherwise capture "categories".
        FunctionCatalog catalog = new FunctionCatalog(service);
        app.get(API_BASE + "/functions", catalog::list);
        app.get(API_BASE + "/functions/categories", catalog::categories);
        app.get(API_BASE + "/functions/category/{category}", catalog::byCategory);
        app.get(API_BASE + "/functions/{name}", catalog::one);

        app.start(config.host(), config.port());

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "formula-server started: host={}, port={}, functions={}, maxFormulaLength={}, maxBodyBytes={}, startupMs={}",
                config.host(),
                app.port(),
                service.registry().size(),
                config.maxFormulaLength(),
                config.maxBodyBytes(),
                elapsedMs);

        return new FormulaServerApp(app, service, config);
    }

    /** The port the server listens on. */
    public int port() {
        return app.port();
    }

    public Javalin javalin() {
        return app;
    }

    public ExpressionService service() {
        return service;
    }

    public ServerConfig config() {
        return config;
    }

    public void stop() {
        app.stop();
        LOG.info("formula-server stopped");
    }
}
