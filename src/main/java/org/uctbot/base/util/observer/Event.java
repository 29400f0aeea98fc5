package org.uctbot.base.util.observer;

public abstract class Event {
}
