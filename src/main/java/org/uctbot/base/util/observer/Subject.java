package org.uctbot.base.util.observer;

public interface Subject {

    void addObserver(Observer observer);

    void notifyObservers(Event event);
}
