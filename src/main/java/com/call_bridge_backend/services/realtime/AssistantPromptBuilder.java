package com.call_bridge_backend.services.realtime;

import com.call_bridge_backend.models.BusinessConfig;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * Builds the assistant's system instructions from a business snapshot.
 */
@Component
public class AssistantPromptBuilder {

    private static final String[] DAYS = {"Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday", "Sunday"};
    private static final DateTimeFormatter TODAY = DateTimeFormatter.ofPattern("d MMMM yyyy", Locale.ENGLISH);

    public String build(BusinessConfig business, LocalDate today) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are a friendly phone assistant for the company '").append(business.getCompanyName()).append("'.");
        if (hasText(business.getReplyStyleDescription())) {
            prompt.append(' ').append(business.getReplyStyleDescription().trim());
        }
        prompt.append("\nTalk as naturally and humanly as possible.");
        prompt.append("\nToday is ")
                .append(today.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH))
                .append(' ')
                .append(today.format(TODAY))
                .append('.');
        prompt.append("\nNever read out numeric dates or times such as '14-08-25' or '10:00'. "
                + "Always say them in words, for example 'ten o'clock' and '14 August 2025'.\n");

        prompt.append("\nHere is some information about the company:\n");
        appendDetails(prompt, business);
        appendContact(prompt, business);
        appendOpeningHours(prompt, business);

        if (!business.getInfo().isEmpty()) {
            prompt.append("\n**General information:**\n");
            business.getInfo().forEach(item -> prompt.append("- ").append(item).append('\n'));
        }

        if (!business.getAppointmentTypes().isEmpty()) {
            prompt.append("\n**Appointment types:**\n");
            business.getAppointmentTypes().forEach(type -> prompt.append("- ")
                    .append(type.getName())
                    .append(" (")
                    .append(type.getDurationMinutes())
                    .append(" minutes)\n"));
        }

        if (!business.getStaffMembers().isEmpty()) {
            prompt.append("\n**Staff:**\n");
            business.getStaffMembers().forEach(staff -> {
                prompt.append("- ").append(staff.getName());
                if (hasText(staff.getRole())) {
                    prompt.append(" (").append(staff.getRole()).append(')');
                }
                prompt.append('\n');
            });
        }

        BusinessConfig.VoiceSettings voice = business.getVoiceSettings();
        if (voice != null && hasText(voice.getWelcomePhrase())) {
            prompt.append("\nStart every conversation with: \"").append(voice.getWelcomePhrase().trim()).append("\".\n");
        }

        if (business.isCalendarEnabled()) {
            prompt.append("\nIMPORTANT: You have access to the company calendar. ALWAYS use the 'check_calendar_availability' "
                    + "tool before proposing a time. Ask for the caller's full name and date of birth before booking with "
                    + "'create_calendar_event'; they are needed to cancel later with 'cancel_calendar_event'. "
                    + "Always ask for explicit confirmation before booking.\n");
        } else {
            prompt.append("\nIMPORTANT: You do NOT have access to the calendar. If a caller wants to make an appointment, "
                    + "explain that you cannot book it automatically and offer to leave a note for the team or to "
                    + "transfer the caller to a colleague.\n");
        }
        prompt.append("Only use 'transfer_call' with a phone number you were explicitly given.\n");
        return prompt.toString();
    }

    private void appendDetails(StringBuilder prompt, BusinessConfig business) {
        prompt.append("\n**Company details:**\n");
        prompt.append("- Name: ").append(business.getCompanyName()).append('\n');
        if (hasText(business.getIndustry())) {
            prompt.append("- Industry: ").append(business.getIndustry()).append('\n');
        }
        if (hasText(business.getDescription())) {
            prompt.append("- Description: ").append(business.getDescription()).append('\n');
        }
    }

    private void appendContact(StringBuilder prompt, BusinessConfig business) {
        if (!hasText(business.getWebsite()) && !hasText(business.getContactEmail())
                && !hasText(business.getContactPhone()) && !hasText(business.getAddress())) {
            return;
        }
        prompt.append("\n**Contact details:**\n");
        if (hasText(business.getWebsite())) {
            prompt.append("- Website: ").append(business.getWebsite()).append('\n');
        }
        if (hasText(business.getContactEmail())) {
            prompt.append("- Email: ").append(business.getContactEmail()).append('\n');
        }
        if (hasText(business.getContactPhone())) {
            prompt.append("- Phone: ").append(business.getContactPhone()).append('\n');
        }
        if (hasText(business.getAddress())) {
            prompt.append("- Address: ").append(business.getAddress()).append('\n');
        }
    }

    private void appendOpeningHours(StringBuilder prompt, BusinessConfig business) {
        if (business.getOpeningHours().isEmpty()) {
            return;
        }
        prompt.append("\n**Opening hours:**\n");
        business.getOpeningHours().forEach(hour -> {
            if (hour.getDayOfWeek() < 1 || hour.getDayOfWeek() > 7) {
                return;
            }
            prompt.append("- ").append(DAYS[hour.getDayOfWeek() - 1]).append(": ");
            if (hour.isOpen()) {
                prompt.append(hour.getOpenTime()).append(" - ").append(hour.getCloseTime());
            } else {
                prompt.append("Closed");
            }
            prompt.append('\n');
        });
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
