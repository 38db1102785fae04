package com.example.proctorstream.broadcast;

public enum RoomType {
    SESSION("session", true),
    OBSERVER_GLOBAL("observer-global", false),
    OBSERVER_EXAM("observer-exam", true),
    STATS_SUBSCRIBERS("stats-subscribers", false);

    private final String prefix;
    private final boolean scoped;

    RoomType(String prefix, boolean scoped) {
        this.prefix = prefix;
        this.scoped = scoped;
    }

    public String getPrefix() { return prefix; }
    public boolean isScoped() { return scoped; }
}
