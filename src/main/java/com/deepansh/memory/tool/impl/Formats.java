package com.deepansh.memory.tool.impl;

/** Text helpers shared by the tool observations. */
final class Formats {

    private Formats() {
    }

    /** "2h 5m" or "5m". */
    static String duration(long totalSecs) {
        long hours = totalSecs / 3600;
        long mins = (totalSecs % 3600) / 60;
        return hours > 0 ? hours + "h " + mins + "m" : mins + "m";
    }

    static String minutes(long totalMinutes) {
        return duration(totalMinutes * 60);
    }
}
