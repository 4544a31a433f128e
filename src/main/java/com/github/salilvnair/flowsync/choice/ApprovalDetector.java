package com.github.salilvnair.flowsync.choice;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic for yes/no style prompts, which surfaces render with approve/reject buttons.
 * Anything that asks for specific input, or lists options, is never an approval.
 */
@Component
public class ApprovalDetector {

    private static final int SHORT_QUESTION_THRESHOLD = 100;

    private static final List<Pattern> REQUIRES_SPECIFIC_INPUT = compile(
            "please (?:select|choose|pick) (?:an? )?option",
            "select (?:an? )?option",
            "let me know",
            "tell me (?:what|how|when|if|about|more)",
            "waiting (?:for|on) (?:your|the)",
            "ready to (?:hear|see|get|receive)",
            "what (?:is|are|should|would)",
            "which (?:one|file|option|method|approach)",
            "where (?:should|would|is|are)",
            "how (?:should|would|do|can)",
            "when (?:should|would)",
            "who (?:should|would)",
            "(?:enter|provide|specify|give|type|input|write)\\s+(?:a|the|your)",
            "what.*(?:name|value|path|url|content|text|message)",
            "please (?:enter|provide|specify|give|type)",
            "describe|explain|elaborate|clarify",
            "what do you (?:think|want|need|prefer)",
            "any (?:suggestions|recommendations|preferences|thoughts)",
            "choose (?:from|between|one of)",
            "select (?:from|one of|which)",
            "pick (?:one|from|between)",
            "\\n\\s*[1-9][.)]\\s+\\S",
            "\\n\\s*[a-d][.)]\\s+\\S",
            "option\\s+[a-d]\\s*:",
            "\\n\\s*[-*•]\\s+\\S",
            "\\n\\s*[0-9]\\uFE0F?\\u20E3\\s+\\S",
            "would you like (?:me to|to):\\s*\\n",
            "[┌├└│┐┤┘─╔╠╚║╗╣╝═]",
            "\\[.+\\]\\s+\\[.+\\]",
            "\\d+[.)]\\s+something else\\??");

    private static final Pattern NUMBERED_ITEM = Pattern.compile("\\n\\s*\\d+[.)]\\s+");

    private static final List<Pattern> APPROVAL = compile(
            "^(?:shall|should|can|could|may|would|will|do|does|did|is|are|was|were|have|has|had)\\s+(?:i|we|you|it|this|that)\\b",
            "(?:proceed|continue|go ahead|start|begin|execute|run|apply|commit|save|delete|remove|create|add|update|modify|change|overwrite|replace).*\\?$",
            "(?:ok|okay|alright|ready|confirm|approve|accept|allow|enable|disable|skip|ignore|dismiss|close|cancel|abort|stop|exit|quit).*\\?$",
            "(?:right|correct|yes|no)\\s*\\?$",
            "(?:is that|does that|would that|should that)\\s+(?:ok|okay|work|help|be\\s+(?:ok|fine|good|acceptable))",
            "(?:do you want|would you like|shall i|should i|can i|may i|could i)",
            "(?:want me to|like me to|need me to)",
            "(?:approve|confirm|authorize|permit|allow)\\s+(?:this|the|these)",
            "(?:yes or no|y/n|yes/no|\\[y/n\\]|\\(y/n\\))",
            "(?:are you sure|do you confirm|please confirm|confirm that)",
            "(?:this will|this would|this is going to)");

    private static final Pattern INTERROGATIVE = Pattern.compile("^(?:what|which|where|when|why|how|who|whom|whose)\\b");

    public boolean isApprovalQuestion(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String lower = text.toLowerCase();
        for (Pattern pattern : REQUIRES_SPECIFIC_INPUT) {
            if (pattern.matcher(lower).find()) {
                return false;
            }
        }
        if (count(NUMBERED_ITEM, text) >= 2) {
            return false;
        }
        for (Pattern pattern : APPROVAL) {
            if (pattern.matcher(lower).find()) {
                return true;
            }
        }
        String trimmed = lower.trim();
        return lower.length() < SHORT_QUESTION_THRESHOLD
                && trimmed.endsWith("?")
                && !INTERROGATIVE.matcher(trimmed).find();
    }

    private static List<Pattern> compile(String... expressions) {
        return Arrays.stream(expressions).map(Pattern::compile).toList();
    }

    private static int count(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        int count = 0;
        while (m.find()) {
            count++;
        }
        return count;
    }
}
