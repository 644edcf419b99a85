package com.call_bridge_backend.utils;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a list of free half-hour slots ("HH:mm") into a sentence the assistant can read out.
 */
public final class SlotSummarizer {

    private SlotSummarizer() {
    }

    public static String summarize(List<String> slots, int openHour, int closeHour) {
        if (slots == null || slots.isEmpty()) {
            return "There are no available times on this day.";
        }

        int totalSlots = Math.max(0, (closeHour - openHour) * 2);
        if (totalSlots > 0 && slots.size() >= totalSlots - 2) {
            List<String> busy = new ArrayList<>();
            for (int hour = openHour; hour < closeHour; hour++) {
                for (String minute : new String[]{"00", "30"}) {
                    String time = String.format("%02d:%s", hour, minute);
                    if (!slots.contains(time)) {
                        busy.add(speak(time));
                    }
                }
            }
            if (busy.isEmpty()) {
                return String.format("I am available all day between %s and %s.",
                        speak(String.format("%02d:00", openHour)), speak(String.format("%02d:00", closeHour)));
            }
            return String.format("I am available all day between %s and %s, except at %s.",
                    speak(String.format("%02d:00", openHour)), speak(String.format("%02d:00", closeHour)),
                    String.join(" and ", busy));
        }

        List<String> spoken = new ArrayList<>();
        for (String slot : slots) {
            spoken.add(speak(slot));
        }
        return "I have the following times available: " + String.join(", ", spoken) + ".";
    }

    /**
     * "09:30" -> "half past nine", "14:00" -> "two o'clock".
     */
    static String speak(String time) {
        String[] parts = time.split(":");
        if (parts.length != 2) {
            return time;
        }
        int hour;
        int minute;
        try {
            hour = Integer.parseInt(parts[0]);
            minute = Integer.parseInt(parts[1]);
        } catch (NumberFormatException e) {
            return time;
        }

        String hourWord = hourWord(hour);
        if (minute == 0) {
            return hourWord + " o'clock";
        }
        if (minute == 30) {
            return "half past " + hourWord;
        }
        return time;
    }

    private static String hourWord(int hour) {
        String[] words = {"twelve", "one", "two", "three", "four", "five", "six",
                "seven", "eight", "nine", "ten", "eleven"};
        return words[Math.floorMod(hour, 12)];
    }
}
