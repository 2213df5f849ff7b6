package com.civica.service.offline;

import com.civica.config.CivicaProperties;
import com.civica.service.cache.EvictionPolicy;
import com.civica.service.cache.ExpiringResponseCache;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Network-free text generator used while the backend is unreachable.
 *
 * Results are cached by the literal summary text with a long TTL and
 * oldest-first eviction. On a miss the template strategy is used when a
 * template set exists for the content type, otherwise the rule-based
 * compositional strategy; with both disabled a fixed sentence is returned.
 */
@Slf4j
public class OfflineResponseGenerator {

    static final String GENERIC_RESPONSE =
            "Based on current political dynamics, this matter requires careful consideration of multiple "
                    + "stakeholder perspectives. The government continues to evaluate options while maintaining "
                    + "focus on public interests and long-term sustainability.";

    static final List<String> SAMPLE_PROMPTS = List.of(
            "Generate a political news headline",
            "Create an opinion piece about climate policy",
            "Write a crisis response statement",
            "Generate voter sentiment analysis",
            "Create social media post about economy");

    private static final Map<String, List<Template>> TEMPLATES = Map.of(
            "political_news", List.of(
                    new Template("Breaking: {party} announces {policy_type} focusing on {topic}", Map.of(
                            "party", List.of("Coalition Government", "Progressive Alliance", "Conservative Party", "Green Movement"),
                            "policy_type", List.of("new legislation", "policy reform", "initiative", "framework"),
                            "topic", List.of("climate action", "economic growth", "healthcare", "education", "housing"))),
                    new Template("{politician} addresses concerns about {issue} in recent statement", Map.of(
                            "politician", List.of("Prime Minister", "Finance Minister", "Climate Secretary", "Health Minister"),
                            "issue", List.of("rising energy costs", "healthcare waiting times", "housing shortage", "educational funding")))),
            "opinion", List.of(
                    new Template("Opinion: Why {topic} should be a priority for the next election", Map.of(
                            "topic", List.of("environmental policy", "economic stability", "social equality", "digital innovation"))),
                    new Template("Analysis: The impact of {policy} on {demographic} communities", Map.of(
                            "policy", List.of("tax reform", "healthcare changes", "education policy", "housing initiative"),
                            "demographic", List.of("young", "elderly", "working", "rural", "urban")))),
            "crisis", List.of(
                    new Template("Emergency response: Government implements {measure} following {crisis_type}", Map.of(
                            "measure", List.of("emergency protocols", "support package", "relief program", "coordination efforts"),
                            "crisis_type", List.of("natural disaster", "economic disruption", "public health concern", "infrastructure failure")))));

    private static final List<String> POLITICAL_TERMS = List.of(
            "coalition", "parliament", "legislation", "policy", "reform", "initiative",
            "democracy", "governance", "constituents", "budget", "taxation", "regulation",
            "sustainability", "innovation", "equality", "justice", "prosperity", "security");

    private static final Map<String, List<String>> CONTEXT_WORDS = Map.of(
            "economy", List.of("growth", "inflation", "employment", "investment", "trade", "market",
                    "fiscal", "monetary", "budget", "deficit", "surplus", "GDP"),
            "environment", List.of("climate", "sustainable", "renewable", "emissions", "green", "carbon",
                    "conservation", "biodiversity", "pollution", "ecosystem", "energy"),
            "society", List.of("community", "equality", "justice", "healthcare", "education", "housing",
                    "welfare", "diversity", "inclusion", "rights", "freedom", "democracy"));

    private static final Map<String, List<String>> STARTERS = Map.of(
            "news", List.of("Breaking news:", "Latest update:", "Reports indicate that", "According to sources",
                    "In a recent development", "Officials confirm that", "New information suggests"),
            "opinion", List.of("In my view,", "It's clear that", "We must consider", "The evidence shows",
                    "Critics argue that", "Supporters believe", "Many experts suggest"),
            "analysis", List.of("Analysis reveals", "Data indicates", "Research shows", "Studies suggest",
                    "Trends point to", "Evidence demonstrates", "Statistics confirm"));

    private static final String DEFAULT_STARTER = "Recent developments show that";

    private static final List<String> CLAUSES = List.of(
            "the government's focus on %s and %s reflects changing priorities",
            "stakeholders emphasize the importance of %s in addressing %s concerns",
            "new initiatives target %s while maintaining %s standards",
            "policy makers balance %s considerations with %s requirements");

    private static final List<String> CONCLUSIONS = List.of(
            "This development is expected to influence upcoming policy decisions.",
            "Further updates will be provided as the situation develops.",
            "Stakeholders continue to monitor the implementation progress.",
            "Public response has been generally positive with some concerns raised.");

    private final ExpiringResponseCache<String> cache;
    private final boolean templateSystem;
    private final boolean ruleBasedGeneration;
    private final Random random;

    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();
    private final AtomicLong generatedResponses = new AtomicLong();

    public OfflineResponseGenerator(CivicaProperties.OfflineConfig config, Clock clock, Random random) {
        this.cache = new ExpiringResponseCache<>("offline",
                config.getMaxCachedResponses(),
                config.getCacheTtl(),
                EvictionPolicy.OLDEST,
                clock);
        this.templateSystem = config.isTemplateSystem();
        this.ruleBasedGeneration = config.isRuleBasedGeneration();
        this.random = random;
    }

    /**
     * Produce text for a summary. Never fails and never touches the network.
     *
     * @param summary         prompt-like summary, also the cache key
     * @param contentTypeHint template family to use ("political_news", "opinion", "crisis", ...)
     */
    public String generate(String summary, String contentTypeHint) {
        String key = summary == null ? "" : summary;

        Optional<String> cached = cache.get(key);
        if (cached.isPresent()) {
            cacheHits.incrementAndGet();
            return cached.get();
        }

        cacheMisses.incrementAndGet();
        String response = generateNew(key, contentTypeHint);
        cache.put(key, response);
        return response;
    }

    /**
     * Fill the cache for prompts that have no live entry yet.
     */
    public void preload(List<String> prompts, String contentTypeHint) {
        int loaded = 0;
        for (String prompt : prompts) {
            if (!cache.containsKey(prompt)) {
                cache.put(prompt, generateNew(prompt, contentTypeHint));
                loaded++;
            }
        }
        log.info("Preloaded {} offline responses", loaded);
    }

    public void preloadSamples() {
        preload(SAMPLE_PROMPTS, "general");
    }

    public void clear() {
        cache.clear();
        cacheHits.set(0);
        cacheMisses.set(0);
        log.info("Offline response cache cleared");
    }

    public OfflineStatistics getStatistics() {
        long hits = cacheHits.get();
        long total = hits + cacheMisses.get();
        return new OfflineStatistics(
                total == 0 ? 0.0 : (double) hits / total,
                cache.size(),
                generatedResponses.get());
    }

    private String generateNew(String prompt, String contentTypeHint) {
        generatedResponses.incrementAndGet();
        if (templateSystem && contentTypeHint != null && TEMPLATES.containsKey(contentTypeHint)) {
            return fillTemplate(TEMPLATES.get(contentTypeHint));
        }
        if (ruleBasedGeneration) {
            return compose(prompt);
        }
        return GENERIC_RESPONSE;
    }

    private String fillTemplate(List<Template> templates) {
        Template template = pick(templates);
        String text = template.getText();
        // Sorted so the draw order, and with it the output for a seeded Random, is stable
        for (String name : template.getVariables().keySet().stream().sorted().toList()) {
            String placeholder = "{" + name + "}";
            if (text.contains(placeholder)) {
                text = text.replace(placeholder, pick(template.getVariables().get(name)));
            }
        }
        return text;
    }

    private String compose(String prompt) {
        String lower = prompt.toLowerCase(Locale.ROOT);
        String context = classifyContext(lower);
        List<String> starters = STARTERS.get(classifyTone(lower));
        String starter = starters == null ? DEFAULT_STARTER : pick(starters);

        List<String> words = new ArrayList<>(CONTEXT_WORDS.getOrDefault(context, List.of()));
        words.addAll(POLITICAL_TERMS);
        String clause = String.format(pick(CLAUSES), pick(words), pick(words));

        return (starter + " " + clause + " " + pick(CONCLUSIONS)).trim();
    }

    static String classifyContext(String lower) {
        if (containsAny(lower, "economy", "economic", "financial")) {
            return "economy";
        }
        if (containsAny(lower, "environment", "climate", "green")) {
            return "environment";
        }
        if (containsAny(lower, "social", "healthcare", "education")) {
            return "society";
        }
        return "general";
    }

    static String classifyTone(String lower) {
        if (containsAny(lower, "news", "headline", "breaking")) {
            return "news";
        }
        if (containsAny(lower, "opinion", "view", "think")) {
            return "opinion";
        }
        if (containsAny(lower, "analysis", "study", "research")) {
            return "analysis";
        }
        return "general";
    }

    private static boolean containsAny(String text, String... needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private <T> T pick(List<T> values) {
        return values.get(random.nextInt(values.size()));
    }

    /**
     * Offline generator counters.
     */
    @Value
    public static class OfflineStatistics {
        double cacheHitRate;
        int cachedResponseCount;
        long generatedResponseCount;
    }

    @Value
    private static class Template {
        String text;
        Map<String, List<String>> variables;
    }
}
