package sitecrawler;

import java.time.Duration;

// A pause that may end early. Returns false when the wait was cut short and the caller should give up.
@FunctionalInterface
public interface Sleeper {

    boolean pause(Duration duration) throws InterruptedException;
}
