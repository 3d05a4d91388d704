package max.movefinder;

import max.movefinder.engine.cli.MoveFinderConfig;
import max.movefinder.engine.cli.MoveFinderServer;

public class Main {
    public static void main(String[] args) {
        MoveFinderConfig config = MoveFinderConfig.fromSystemProperties();
        if (config.debug) {
            System.err.println("Starting move finder with " + config);
        }
        new MoveFinderServer(config).run();
    }
}
