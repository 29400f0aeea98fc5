package org.uctbot.base.util.observer;

public interface Observer {

    void observe(Event event);
}
