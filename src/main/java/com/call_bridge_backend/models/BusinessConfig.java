package com.call_bridge_backend.models;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Everything the assistant needs to know about one business, captured once when a call starts.
 * Immutable so a running call never observes changes made to the business meanwhile.
 */
@Value
@Builder(toBuilder = true)
public class BusinessConfig {

    Long companyId;
    String companyName;
    String phoneNumber;
    String assistantId;
    String replyStyleName;
    String replyStyleDescription;
    String industry;
    String description;
    String website;
    String contactEmail;
    String contactPhone;
    String address;
    @Singular("openingHour")
    List<OpeningHour> openingHours;
    @Singular("infoItem")
    List<String> info;
    @Singular
    List<AppointmentType> appointmentTypes;
    @Singular
    List<StaffMember> staffMembers;
    boolean calendarEnabled;
    String calendarProvider;
    VoiceSettings voiceSettings;

    /**
     * Opening hours for an ISO day of week (1 = Monday).
     */
    public Optional<OpeningHour> openingHourFor(int dayOfWeek) {
        return openingHours.stream()
                .filter(hour -> hour.getDayOfWeek() == dayOfWeek)
                .findFirst();
    }

    @Value
    @Builder
    public static class OpeningHour {
        int dayOfWeek;
        boolean open;
        String openTime;
        String closeTime;
    }

    @Value
    @Builder
    public static class AppointmentType {
        String name;
        int durationMinutes;
    }

    @Value
    @Builder
    public static class StaffMember {
        String name;
        String role;
    }

    @Value
    @Builder
    public static class VoiceSettings {
        String voiceId;
        double talkingSpeed;
        String welcomePhrase;
    }
}
