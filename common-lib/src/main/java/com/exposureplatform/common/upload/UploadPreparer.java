package com.exposureplatform.common.upload;

import com.exposureplatform.common.model.ExposureInfo;
import com.exposureplatform.common.model.ExposureSummary;
import com.exposureplatform.common.model.RiskPolicy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Selects the bounded subset of stored exposure history that is uploaded together with
 * the diagnosis keys.
 *
 * <p>Pure function over already-loaded summaries. Local storage is never modified.
 *
 * <h3>Passes</h3>
 * <ol>
 *   <li><strong>Filter summaries</strong>: sort by check date, newest first, keep
 *       {@code maxSummaryCount}.</li>
 *   <li><strong>Rank infos</strong>: tag each info with the position of its summary in the
 *       filtered list, sort all tagged infos by {@code totalRiskScore} descending then
 *       {@code date} ascending, keep {@code maxInfoCount}.</li>
 *   <li><strong>Rebuild</strong>: give each filtered summary back the infos that survived
 *       (possibly none) and convert it to its upload form.</li>
 * </ol>
 *
 * <h3>Guarantees</h3>
 * <ul>
 *   <li>At most {@code maxSummaryCount} summaries and {@code maxInfoCount} infos in total.</li>
 *   <li>Output keeps the newest-first summary order.</li>
 *   <li>Infos are dropped, never merged or recomputed.</li>
 * </ul>
 */
public final class UploadPreparer {

    /** Newest check first; summaries without a date sink to the end. */
    static final Comparator<ExposureSummary> NEWEST_FIRST =
        Comparator.comparing(ExposureSummary::date, Comparator.nullsLast(Comparator.reverseOrder()));

    /** Highest risk first; among equal risk the older exposure day first. */
    static final Comparator<TaggedInfo> RISK_THEN_DATE =
        Comparator.comparingInt((TaggedInfo t) -> t.info().totalRiskScore()).reversed()
            .thenComparing(t -> t.info().date(), Comparator.nullsLast(Comparator.naturalOrder()));

    /**
     * An exposure info paired with the position of its parent summary in the filtered,
     * newest-first list. The index is positional, not a stored identity.
     */
    record TaggedInfo(int summaryIndex, ExposureInfo info) {}

    public List<UploadSummary> prepare(List<ExposureSummary> summaries,
                                       RiskPolicy policy,
                                       Instant uploadServerDate) {
        Objects.requireNonNull(policy, "policy");
        if (summaries == null || summaries.isEmpty()) {
            return List.of();
        }

        List<ExposureSummary> selected = selectSummaries(summaries, policy.maxSummaryCount());
        List<TaggedInfo> ranked = rankInfos(selected);
        List<TaggedInfo> kept = ranked.subList(0, Math.min(ranked.size(), Math.max(0, policy.maxInfoCount())));

        return rebuild(selected, kept).stream()
            .map(summary -> UploadSummary.from(summary, uploadServerDate))
            .toList();
    }

    // ── Pass 1 ─────────────────────────────────────────────────────────────

    static List<ExposureSummary> selectSummaries(List<ExposureSummary> summaries, int maxSummaryCount) {
        return summaries.stream()
            .sorted(NEWEST_FIRST)
            .limit(Math.max(0, maxSummaryCount))
            .toList();
    }

    // ── Pass 2 ─────────────────────────────────────────────────────────────

    /**
     * Returns every info of the given summaries, tagged and globally ranked, before any
     * truncation.
     */
    static List<TaggedInfo> rankInfos(List<ExposureSummary> selected) {
        List<TaggedInfo> tagged = new ArrayList<>();
        for (int index = 0; index < selected.size(); index++) {
            for (ExposureInfo info : selected.get(index).exposureInfos()) {
                tagged.add(new TaggedInfo(index, info));
            }
        }
        tagged.sort(RISK_THEN_DATE);
        return tagged;
    }

    // ── Pass 3 ─────────────────────────────────────────────────────────────

    static List<ExposureSummary> rebuild(List<ExposureSummary> selected, List<TaggedInfo> kept) {
        List<List<ExposureInfo>> buckets = new ArrayList<>(selected.size());
        for (int i = 0; i < selected.size(); i++) {
            buckets.add(new ArrayList<>());
        }
        for (TaggedInfo tagged : kept) {
            buckets.get(tagged.summaryIndex()).add(tagged.info());
        }

        List<ExposureSummary> rebuilt = new ArrayList<>(selected.size());
        for (int i = 0; i < selected.size(); i++) {
            rebuilt.add(selected.get(i).withExposureInfos(buckets.get(i)));
        }
        return rebuilt;
    }
}
