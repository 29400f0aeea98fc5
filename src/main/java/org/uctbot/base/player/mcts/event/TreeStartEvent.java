package org.uctbot.base.player.mcts.event;

import org.uctbot.base.util.observer.Event;

public class TreeStartEvent extends Event {
}
