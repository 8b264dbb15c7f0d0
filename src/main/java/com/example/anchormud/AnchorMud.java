package com.example.anchormud;

import com.example.anchormud.combat.ActionOutcome;
import com.example.anchormud.model.PlayerCharacter;
import com.example.anchormud.net.commands.CommandDispatcher;
import com.example.anchormud.persistence.CharacterSheetStore;
import com.example.anchormud.persistence.H2CharacterSheetDAO;
import com.example.anchormud.persistence.PersistenceException;
import com.example.anchormud.persistence.SettingsDAO;
import com.example.anchormud.persistence.SettingsStore;
import com.example.anchormud.persistence.WorldContent;
import com.example.anchormud.persistence.YamlContentLoader;
import com.example.anchormud.util.GameClock;
import com.example.anchormud.util.GameConfig;
import com.example.anchormud.util.TimeSource;
import com.example.anchormud.world.WorldRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Random;

/**
 * Starts the runtime and attaches one local console session to it.
 * The network transport is a separate collaborator; this entry point exists
 * to play the world from a terminal.
 */
public class AnchorMud {
    private static final Logger logger = LoggerFactory.getLogger(AnchorMud.class);

    public static void main(String[] args) throws IOException {
        String name = args.length > 0 ? args[0] : "Wanderer";

        GameConfig config = GameConfig.load();
        GameClock clock = new GameClock(TimeSource.SYSTEM, config.timeRatio(), config.startSeconds());
        WorldContent content = new YamlContentLoader().load();

        String url = config.getString(GameConfig.PERSISTENCE_URL, "jdbc:h2:mem:anchormud;DB_CLOSE_DELAY=-1");
        String user = config.getString(GameConfig.PERSISTENCE_USER, "sa");
        String pass = config.getString(GameConfig.PERSISTENCE_PASSWORD, "");
        CharacterSheetStore sheets = null;
        SettingsStore settings = null;
        try {
            sheets = new H2CharacterSheetDAO(url, user, pass);
            settings = new SettingsDAO(url, user, pass);
        } catch (PersistenceException e) {
            logger.warn("[AnchorMud] Persistence unavailable, running without saves: {}", e.getMessage());
        }

        // local console play has no account store; every name is accepted
        WorldRuntime runtime = new WorldRuntime(config, clock, content, sheets,
                (account, credential) -> true, settings, new Random());
        CommandDispatcher.initialize();
        runtime.start();
        Runtime.getRuntime().addShutdownHook(new Thread(runtime::shutdown, "anchormud-shutdown"));

        ActionOutcome connected = runtime.connect(name, "", message -> System.out.println(message.text()));
        System.out.println(connected.getNotice());
        if (!connected.isAccepted()) {
            runtime.shutdown();
            return;
        }
        String ref = PlayerCharacter.refFor(name);

        try (BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                if ("quit".equalsIgnoreCase(line.trim())) break;
                CommandDispatcher.execute(runtime, ref, line);
            }
        }
        runtime.disconnect(ref);
        logger.info("[AnchorMud] Console session closed");
        System.exit(0);
    }
}
