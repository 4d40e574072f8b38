package com.masterbias.main;

import com.masterbias.model.CombineSettings;

public class MasterBiasMakerApp {

    // Tiempo que el hook de cierre espera a que termine el grupo en curso
    private static final long SHUTDOWN_GRACE_MS = 30_000;

    public static void main(String[] args) {
        if (args.length == 0) {
            System.out.println(CommandLineOptions.USAGE);
            return;
        }
        CommandLineHandler handler = new CommandLineHandler();
        Thread hook = cancelOnShutdown(handler, Thread.currentThread());
        Runtime.getRuntime().addShutdownHook(hook);

        int code = handler.execute(args, CombineSettings.fromPreferences());

        // Terminado normalmente: el hook ya no tiene nada que cancelar
        Runtime.getRuntime().removeShutdownHook(hook);
        if (code != 0) System.exit(code);
    }

    /** Ctrl-C: cancel the session and give the current group time to finish or be discarded. */
    static Thread cancelOnShutdown(CommandLineHandler handler, Thread worker) {
        return new Thread(() -> {
            handler.getSession().cancel();
            try {
                worker.join(SHUTDOWN_GRACE_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "session-shutdown");
    }
}
