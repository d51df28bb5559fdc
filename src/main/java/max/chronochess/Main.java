package max.chronochess;

import max.chronochess.engine.EngineConfig;
import max.chronochess.engine.console.EngineConsole;

public class Main {
    public static void main(String[] args) {
        new EngineConsole(EngineConfig.fromSystemProperties()).run();
    }
}
