package com.gentoro.intake.worker;

/** Callback notified by a worker after every job, successful or not. */
@FunctionalInterface
public interface JobListener {
  JobListener NONE = result -> {};

  void onCompleted(JobResult result);
}
