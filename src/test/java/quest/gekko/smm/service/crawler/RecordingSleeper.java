package quest.gekko.smm.service.crawler;

import org.springframework.retry.backoff.Sleeper;

import java.util.ArrayList;
import java.util.List;

/** Records requested pauses instead of sleeping. */
class RecordingSleeper implements Sleeper {

    final List<Long> sleeps = new ArrayList<>();

    @Override
    public synchronized void sleep(long backOffPeriod) {
        sleeps.add(backOffPeriod);
    }
}
