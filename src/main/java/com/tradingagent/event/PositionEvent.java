package com.tradingagent.event;

import com.tradingagent.domain.model.Position;
import com.tradingagent.domain.model.Trade;
import org.springframework.context.ApplicationEvent;

/**
 * Published by {@code ExecutionAgent} when a position is opened on a confirmed entry fill or closed
 * on a confirmed exit fill.
 */
public class PositionEvent extends ApplicationEvent {

    private final Position position;
    private final Trade trade;
    private final PositionEventType eventType;

    /**
     * @param source    the component publishing this event
     * @param position  the position snapshot at the time of the change
     * @param trade     the trade the position belongs to; carries realised P&L for CLOSED events
     * @param eventType what kind of position change occurred
     */
    public PositionEvent(Object source, Position position, Trade trade, PositionEventType eventType) {
        super(source);
        this.position = position;
        this.trade = trade;
        this.eventType = eventType;
    }

    public Position getPosition() {
        return position;
    }

    public Trade getTrade() {
        return trade;
    }

    public PositionEventType getEventType() {
        return eventType;
    }
}
