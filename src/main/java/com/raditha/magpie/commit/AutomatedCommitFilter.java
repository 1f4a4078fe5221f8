package com.raditha.magpie.commit;

import com.raditha.magpie.model.CommitRecord;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Recognizes commits made by tools rather than people: merges, version bumps and bot commits.
 * Such commits look alike across unrelated repositories and would only add noise.
 */
public class AutomatedCommitFilter {

    private static final Pattern BOT_WORD = Pattern.compile("\\bbot\\b|\\[bot]");

    public boolean isAutomated(CommitRecord commit) {
        return isAutomated(commit.message());
    }

    public boolean isAutomated(String message) {
        if (message == null || message.isBlank()) {
            return true;
        }
        String msg = message.trim().toLowerCase(Locale.ROOT);
        return msg.startsWith("merge")
                || msg.startsWith("bump ")
                || msg.contains("dependabot")
                || BOT_WORD.matcher(msg).find();
    }
}
