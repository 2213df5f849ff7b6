package com.civica.service.canonicalization;

import com.civica.model.ActorSnapshot;
import com.civica.model.BehaviorVector;
import com.civica.model.OpinionVector;
import com.civica.model.RequestType;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Derives the two cache keys of a request.
 *
 * Exact key: SHA-256 over the full-precision content (request type, subject,
 * demographics, opinion and behavior vectors). Only byte-identical repeats share it.
 *
 * Bucket key: readable signature over coarsely quantized fields
 * (age decade, education, income bracket, economic/social axes and satisfaction
 * at one decimal). Actors with near-identical profiles collapse onto it.
 *
 * The actor id never takes part in either key. Pure functions, no state.
 */
@Service
public class RequestKeyGenerator {

    private static final String SEPARATOR = "|";

    // Guards the one-decimal floor against 0.3 * 10 = 2.9999999999999996
    private static final double QUANTIZE_EPSILON = 1e-9;

    private static final int SUBJECT_DIGEST_CHARS = 16;

    /**
     * Generate the exact-content key.
     *
     * @param snapshot actor snapshot
     * @param type     request type
     * @param subject  political content the request is about, may be null
     * @return SHA-256 hash (64 hex chars)
     */
    public String exactKey(ActorSnapshot snapshot, RequestType type, String subject) {
        OpinionVector opinion = snapshot.getOpinion();
        BehaviorVector behavior = snapshot.getBehavior();

        String canonical = String.join(SEPARATOR,
                type.name(),
                normalizeSubject(subject),
                Integer.toString(snapshot.getAge()),
                Integer.toString(snapshot.getEducationLevel()),
                Integer.toString(snapshot.getIncomeBracket()),
                snapshot.getRegion() == null ? "" : snapshot.getRegion(),
                Double.toString(opinion.getEconomic()),
                Double.toString(opinion.getSocial()),
                Double.toString(opinion.getEnvironmental()),
                Double.toString(behavior.getSatisfaction()),
                Double.toString(behavior.getEngagement()),
                Double.toString(behavior.getVolatility()));

        return DigestUtils.sha256Hex(canonical);
    }

    /**
     * Generate the similarity-bucket key.
     *
     * @param snapshot actor snapshot
     * @param type     request type
     * @param subject  political content the request is about, may be null
     * @return bucket signature, e.g. {@code GENERAL_ANALYSIS_40_3_5_0.2_-0.4_0.7}
     */
    public String bucketKey(ActorSnapshot snapshot, RequestType type, String subject) {
        int ageGroup = ageGroup(snapshot.getAge());

        StringBuilder key = new StringBuilder()
                .append(type.name()).append('_')
                .append(ageGroup).append('_')
                .append(snapshot.getEducationLevel()).append('_')
                .append(snapshot.getIncomeBracket()).append('_')
                .append(format(quantize(snapshot.getOpinion().getEconomic()))).append('_')
                .append(format(quantize(snapshot.getOpinion().getSocial()))).append('_')
                .append(format(quantize(snapshot.getBehavior().getSatisfaction())));

        String normalizedSubject = normalizeSubject(subject);
        if (!normalizedSubject.isEmpty()) {
            key.append("_s").append(DigestUtils.sha256Hex(normalizedSubject), 0, SUBJECT_DIGEST_CHARS);
        }

        return key.toString();
    }

    /**
     * Age rounded down to its decade.
     */
    static int ageGroup(int age) {
        return Math.max(0, age) / 10 * 10;
    }

    /**
     * Floor to one decimal.
     */
    static double quantize(double value) {
        double scaled = Math.floor(value * 10.0 + QUANTIZE_EPSILON) / 10.0;
        // Collapse -0.0 onto 0.0 so both print the same
        return scaled == 0.0 ? 0.0 : scaled;
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    /**
     * Trim and collapse whitespace; null becomes empty.
     */
    public static String normalizeSubject(String subject) {
        if (subject == null) {
            return "";
        }
        return subject.trim().replaceAll("\\s+", " ");
    }
}
