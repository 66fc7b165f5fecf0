package org.surff.pool;

import java.util.Objects;

/**
 * What travels through a {@link JobChannel}: either a job to run or a signal
 * telling the receiving worker to stop.
 */
public sealed interface Message permits Message.NewJob, Message.Terminate {

    static Message job(Job job) {
        return new NewJob(job);
    }

    static Message terminate() {
        return Terminate.INSTANCE;
    }

    record NewJob(Job job) implements Message {
        public NewJob {
            Objects.requireNonNull(job, "job");
        }
    }

    enum Terminate implements Message {
        INSTANCE
    }
}
