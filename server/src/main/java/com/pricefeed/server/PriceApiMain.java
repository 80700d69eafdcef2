package com.pricefeed.server;

import com.pricefeed.core.model.FeedConfig;
import com.pricefeed.core.service.PriceService;
import com.pricefeed.core.util.YamlConfigLoader;
import com.pricefeed.server.logging.LogSetup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;

/** 실행 진입점: [pricefeed.yml 경로] 를 받아 서버를 띄운다. */
public final class PriceApiMain {

    private static final Logger LOG = LoggerFactory.getLogger(PriceApiMain.class);

    private PriceApiMain() {}

    public static void main(String[] args) throws Exception {
        LogSetup.init(Path.of(System.getProperty("pf.log.dir", "logs")));

        FeedConfig cfg = (args.length > 0)
                ? YamlConfigLoader.load(Path.of(args[0]))
                : YamlConfigLoader.loadDefault();

        PriceService service = new PriceService(cfg);
        PriceApiServer server = new PriceApiServer(service,
                cfg.server().getHost(), cfg.server().getPort(), Clock.systemDefaultZone());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down price API");
            server.close();
            service.close();
        }, "pf-shutdown"));

        server.start();
    }
}
