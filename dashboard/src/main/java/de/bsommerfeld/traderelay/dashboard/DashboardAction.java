package de.bsommerfeld.traderelay.dashboard;

/**
 * The actions the dashboard endpoint dispatches on. The wire name goes into
 * the {@code action} member of the request body.
 */
public enum DashboardAction {

    GET_EVENTS("get_events"),
    MARK_EVENTS_POSTED("mark_events_posted"),
    GET_PORTFOLIO_SUMMARY("get_portfolio_summary"),
    GET_POSITIONS("get_positions"),
    GET_DECISIONS("get_decisions"),
    GET_EVENT_STATS("get_event_stats");

    private final String wireName;

    DashboardAction(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
