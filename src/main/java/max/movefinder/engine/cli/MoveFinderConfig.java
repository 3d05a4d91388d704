package max.movefinder.engine.cli;

public final class MoveFinderConfig {

    public final boolean debug;
    // Print the labeled board before the moves
    public final boolean showBoard;
    // Print the input prompts, turn it off when input is piped
    public final boolean showPrompts;
    // Generate the moves of each piece on the common fork-join pool
    public final boolean parallel;

    private MoveFinderConfig(Builder b) {
        this.debug = b.debug;
        this.showBoard = b.showBoard;
        this.showPrompts = b.showPrompts;
        this.parallel = b.parallel;
    }

    public static MoveFinderConfig fromSystemProperties() {
        return new Builder()
                .debug(Boolean.parseBoolean(System.getProperty("movefinder.debug", "false")))
                .showBoard(Boolean.parseBoolean(System.getProperty("movefinder.board", "true")))
                .showPrompts(Boolean.parseBoolean(System.getProperty("movefinder.prompts", "true")))
                .parallel(Boolean.parseBoolean(System.getProperty("movefinder.parallel", "false")))
                .build();
    }

    @Override
    public String toString() {
        return "MoveFinderConfig{" +
                "debug=" + debug +
                ", showBoard=" + showBoard +
                ", showPrompts=" + showPrompts +
                ", parallel=" + parallel +
                '}';
    }

    public static final class Builder {
        private boolean debug = false;
        private boolean showBoard = true;
        private boolean showPrompts = true;
        private boolean parallel = false;

        public Builder debug(boolean v){debug=v;return this;}
        public Builder showBoard(boolean v){showBoard=v;return this;}
        public Builder showPrompts(boolean v){showPrompts=v;return this;}
        public Builder parallel(boolean v){parallel=v;return this;}
        public MoveFinderConfig build(){return new MoveFinderConfig(this);}
    }
}
