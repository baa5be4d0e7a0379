package com.aerostar.service;

import com.aerostar.core.error.SchemaMismatchException;
import com.aerostar.service.runtime.JobSettings;
import com.aerostar.service.runtime.TransformJob;
import com.aerostar.service.store.JsonlEventLog;

import java.time.Clock;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) {
        JobSettings settings = JobSettings.resolve(args, System.getenv());
        TransformJob job = new TransformJob(settings, new JsonlEventLog(settings.eventLogFile()), Clock.systemUTC());
        try {
            TransformJob.Outcome outcome = job.run();
            LOGGER.info("Transform finished: " + outcome.result().summary());
        } catch (SchemaMismatchException e) {
            LOGGER.log(Level.SEVERE, "Input " + settings.input() + " does not match the expected schema", e);
            System.exit(2);
        }
    }
}
