// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers.tagging;

import ai.vespa.textlayers.Layer;
import ai.vespa.textlayers.Text;
import ai.vespa.textlayers.resolve.ConflictResolverConfig;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tags the matches of a list of regular expression rules in the raw text. Each rule has a priority,
 * and overlapping matches are resolved as configured.
 */
public class RegexTagger extends ConflictResolvingTagger {

    private final List<Rule> rules;

    public RegexTagger(String outputLayer, List<String> attributes, List<Rule> rules, boolean ambiguous,
                       ConflictResolverConfig config) {
        super(outputLayer, withPriority(attributes, config), List.of(), ambiguous, config);
        this.rules = ImmutableList.copyOf(rules);
    }

    private static List<String> withPriority(List<String> attributes, ConflictResolverConfig config) {
        if (attributes.contains(config.priorityAttribute())) return attributes;
        List<String> all = new ArrayList<>(attributes);
        all.add(config.priorityAttribute());
        return all;
    }

    public List<Rule> rules() { return rules; }

    @Override
    protected void addCandidates(Text text, Map<String, Layer> inputs, Layer candidates) {
        for (Rule rule : rules) {
            Matcher matcher = rule.pattern().matcher(text.text());
            while (matcher.find()) {
                if (matcher.start() == matcher.end()) continue;
                Map<String, Object> values = new LinkedHashMap<>(rule.values());
                values.put(priorityAttribute(), rule.priority());
                candidates.addSpan(matcher.start(), matcher.end(), values);
            }
        }
    }

    /** A pattern to tag, the attribute values to tag its matches with, and its priority. Lower priorities win. */
    public static final class Rule {

        private final Pattern pattern;
        private final Map<String, Object> values;
        private final int priority;

        public Rule(String regex, Map<String, ?> values, int priority) {
            this(Pattern.compile(regex), values, priority);
        }

        public Rule(Pattern pattern, Map<String, ?> values, int priority) {
            this.pattern = Objects.requireNonNull(pattern);
            this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
            this.priority = priority;
        }

        public Pattern pattern() { return pattern; }

        public Map<String, Object> values() { return values; }

        public int priority() { return priority; }

        @Override
        public String toString() {
            return "rule '" + pattern + "' with priority " + priority;
        }

    }

}
