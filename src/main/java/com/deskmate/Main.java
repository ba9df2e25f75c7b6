package com.deskmate;

import com.deskmate.controllers.ChatController;
import com.deskmate.controllers.Controller;
import com.deskmate.controllers.ModelController;
import com.deskmate.controllers.SettingsController;
import com.deskmate.controllers.VisionController;
import com.deskmate.directives.AnimationDirectiveHandler;
import com.deskmate.directives.InlineDirectiveScanner;
import com.deskmate.directives.ResponseNormalizer;
import com.deskmate.live2d.AnimationController;
import com.deskmate.live2d.ModelHandle;
import com.deskmate.live2d.ModelLoader;
import com.deskmate.providers.chat.ChatClient;
import com.deskmate.providers.chat.HttpChatTransport;
import com.deskmate.settings.PreferencesStore;
import com.deskmate.vision.RobotCaptureSource;
import com.deskmate.vision.VisionService;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

public class Main {

    private static final String VERSION = "1.0.0";
    private static final long FRAME_INTERVAL_MS = 1000 / 60;
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 2;
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            AppConfig config = new AppConfig.Builder()
                    .parseArgs(args)
                    .build();

            AppLogger.initialize(config.getLogPath(), config.isDevMode());
            logger = AppLogger.get();
            printBanner(config);

            PreferencesStore preferences = new PreferencesStore(config.getDataPath());
            InlineDirectiveScanner scanner = new InlineDirectiveScanner(objectMapper);
            ResponseNormalizer normalizer = new ResponseNormalizer(objectMapper, scanner);
            ChatClient chatClient = new ChatClient(objectMapper, new HttpChatTransport(objectMapper), normalizer);

            ScheduledExecutorService animationExecutor = DirectiveFlushScheduler.newAnimationExecutor();
            AnimationController animation = new AnimationController(objectMapper);
            ModelHandle backend = new ModelLoader(config.getBackendClass()).load(config.getModelPath());
            animationExecutor.submit(() -> animation.loadModel(backend, config.getModelPath())).get();

            ExpressionLibrary expressions = new ExpressionLibrary(preferences, animation);
            ChatOrchestrator orchestrator = new ChatOrchestrator(preferences, chatClient, expressions);
            orchestrator.registerHandler(new AnimationDirectiveHandler(animation, expressions));

            VisionService vision = new VisionService(preferences, new RobotCaptureSource(preferences.getVisionDir()));
            orchestrator.attachVisionService(vision);
            if (vision.getConfig().isEnabled()) {
                vision.start();
            }

            animationExecutor.scheduleAtFixedRate(() -> {
                try {
                    animation.updateAndDraw();
                } catch (Exception e) {
                    logger.warn("[Main] Frame failed: " + e.getMessage());
                }
            }, 0, FRAME_INTERVAL_MS, TimeUnit.MILLISECONDS);
            DirectiveFlushScheduler flushScheduler = new DirectiveFlushScheduler(
                orchestrator, animationExecutor, DirectiveFlushScheduler.DEFAULT_INTERVAL_MS);
            flushScheduler.start();

            Javalin app = Javalin.create(cfg -> {
                cfg.jsonMapper(new JavalinJackson(objectMapper, false));
                cfg.http.defaultContentType = "application/json";
            });

            List<Controller> controllers = List.of(
                new ChatController(orchestrator, objectMapper),
                new SettingsController(preferences, orchestrator, objectMapper),
                new ModelController(animation, expressions, orchestrator, scanner, animationExecutor, objectMapper),
                new VisionController(vision, objectMapper)
            );
            for (Controller controller : controllers) {
                controller.registerRoutes(app);
            }
            registerExceptionHandlers(app);

            app.start(config.getPort());

            String url = "http://localhost:" + config.getPort() + "/";
            logger.info("Server started on " + url);
            logger.console("");
            logger.console("  Listening on " + url);
            logger.console("  Data: " + config.getDataPath());
            logger.console("  Model: " + (config.getModelPath() != null ? config.getModelPath() : "(none)"));
            logger.console("  Log file: " + config.getLogPath());
            logger.console("");
            logger.console("========================================");
            logger.console("  Press Ctrl+C to stop");
            logger.console("========================================");

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                app.stop();
                vision.stop();
                orchestrator.close();
                flushScheduler.stop();
                disposeOnAnimationThread(animation, animationExecutor);
                animationExecutor.shutdownNow();
                logger.close();
            }));

        } catch (Exception e) {
            System.err.println("Failed to start Deskmate: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  Deskmate v" + VERSION);
        logger.console("========================================");
        logger.console("  Starting server...");
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
    }

    /**
     * The backend is only touched from the animation thread, including on the way out.
     */
    static void disposeOnAnimationThread(AnimationController animation, ScheduledExecutorService animationExecutor) {
        try {
            animationExecutor.submit(animation::dispose).get(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            AppLogger.warn("Main", "Interrupted while disposing the model");
        } catch (Exception e) {
            AppLogger.warn("Main", "Model dispose failed: " + e.getMessage());
        }
    }

    private static void registerExceptionHandlers(Javalin app) {
        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            logger.warn("Bad request: " + e.getMessage());
            ctx.status(400).json(Controller.errorBody(e));
        });

        app.exception(Exception.class, (e, ctx) -> {
            logger.error("Unhandled exception: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        });
    }
}
