package com.peargent.state;

import com.peargent.providers.GenerateOptions;
import com.peargent.providers.ModelProvider;
import com.peargent.shared.model.Message;

import java.util.List;

/**
 * Condenses messages that fall out of the context window into one text.
 */
@FunctionalInterface
public interface Summarizer {

    String summarize(List<Message> dropped);

    /** Deterministic digest: one clipped line per message. */
    static Summarizer digest(int maxCharsPerMessage) {
        return dropped -> {
            var sb = new StringBuilder("Summary of ")
                    .append(dropped.size())
                    .append(" earlier message(s):");
            for (var m : dropped) {
                var speaker = m.agent() != null ? m.agent() : m.role().wireName();
                var text = m.content().replaceAll("\\s+", " ").trim();
                if (text.length() > maxCharsPerMessage) text = text.substring(0, maxCharsPerMessage) + "...";
                sb.append("\n- ").append(speaker).append(": ").append(text);
            }
            return sb.toString();
        };
    }

    static Summarizer model(ModelProvider model) {
        return dropped -> {
            var prompt = new StringBuilder(
                    "Summarize the following conversation excerpt in a few sentences. "
                    + "Keep names, decisions and open questions.\n\n");
            for (var m : dropped) {
                var speaker = m.agent() != null ? m.agent() : m.role().wireName();
                prompt.append(speaker).append(": ").append(m.content()).append("\n");
            }
            return model.generate(prompt.toString(), GenerateOptions.defaults());
        };
    }
}
