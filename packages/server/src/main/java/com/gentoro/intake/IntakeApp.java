package com.gentoro.intake;

public class IntakeApp {

  private static final org.slf4j.Logger log =
      com.gentoro.intake.logging.LoggingService.getLogger(IntakeApp.class);

  public static void main(String[] args) {
    int status;
    try {
      IntakeService app = new IntakeService(args);
      app.initialize();
      // Keep the service running until shutdown signal or consumer failure
      app.waitShutdownSignal();
      status = app.exitCode();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      status = 1;
    }
    System.exit(status);
  }
}
