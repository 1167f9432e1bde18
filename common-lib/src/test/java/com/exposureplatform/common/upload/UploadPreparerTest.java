package com.exposureplatform.common.upload;

import com.exposureplatform.common.model.ExposureInfo;
import com.exposureplatform.common.model.ExposureSummary;
import com.exposureplatform.common.model.RiskPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verification of the three-pass {@link UploadPreparer}: summary filtering, global info
 * ranking and per-summary rebuild.
 */
class UploadPreparerTest {

    private final UploadPreparer preparer = new UploadPreparer();

    private static Instant day(int n) {
        return Instant.EPOCH.plus(n, ChronoUnit.DAYS);
    }

    private static ExposureInfo info(int exposureDay, int risk) {
        return new ExposureInfo(day(exposureDay), 15, 60, List.of(10, 5), 3, risk);
    }

    private static ExposureSummary summary(int checkDay, ExposureInfo... infos) {
        return new ExposureSummary(day(checkDay), day(checkDay - 1), infos.length, 10,
            5, 10, 15, 40, List.of(infos));
    }

    private static int totalInfos(List<UploadSummary> result) {
        return result.stream().mapToInt(s -> s.exposureInfos().size()).sum();
    }

    // ── Caps ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("prepare(): caps")
    class CapTests {

        @Test
        @DisplayName("empty input → empty output")
        void emptyInput() {
            assertTrue(preparer.prepare(List.of(), new RiskPolicy(0, 3, 5), day(30)).isEmpty());
            assertTrue(preparer.prepare(null, new RiskPolicy(0, 3, 5), day(30)).isEmpty());
        }

        @Test
        @DisplayName("5 summaries / 12 infos with caps 3 and 5 → ranked infos of the 3 newest only")
        void fiveSummariesTwelveInfos() {
            List<ExposureSummary> stored = new ArrayList<>(List.of(
                summary(1, info(0, 99), info(0, 98), info(0, 97)),   // oldest, highest risk
                summary(2, info(1, 96), info(1, 95)),
                summary(3, info(2, 40), info(2, 10)),
                summary(4, info(3, 70), info(2, 70), info(3, 20)),
                summary(5, info(4, 50), info(4, 5))
            ));
            Collections.shuffle(stored);

            List<UploadSummary> result = preparer.prepare(stored, new RiskPolicy(0, 3, 5), day(6));

            assertEquals(3, result.size());
            assertEquals(LocalDate.of(1970, 1, 6), result.get(0).date());
            assertEquals(LocalDate.of(1970, 1, 5), result.get(1).date());
            assertEquals(LocalDate.of(1970, 1, 4), result.get(2).date());
            assertEquals(5, totalInfos(result));

            // check day 5: only the 50
            assertEquals(List.of(50), result.get(0).exposureInfos().stream()
                .map(UploadExposureInfo::totalRiskScore).toList());
            // check day 4: both 70s (older exposure day first) and the 20
            assertEquals(List.of(70, 70, 20), result.get(1).exposureInfos().stream()
                .map(UploadExposureInfo::totalRiskScore).toList());
            assertEquals(LocalDate.of(1970, 1, 3), result.get(1).exposureInfos().get(0).date());
            // check day 3: only the 40
            assertEquals(List.of(40), result.get(2).exposureInfos().stream()
                .map(UploadExposureInfo::totalRiskScore).toList());
        }

        @Test
        @DisplayName("a recent summary with only low-risk infos keeps no infos")
        void recentLowRiskSummaryLosesInfos() {
            List<ExposureSummary> stored = List.of(
                summary(10, info(9, 1), info(9, 2)),
                summary(8, info(7, 80), info(6, 90))
            );

            List<UploadSummary> result = preparer.prepare(stored, new RiskPolicy(0, 5, 2), day(11));

            assertEquals(2, result.size());
            assertTrue(result.get(0).exposureInfos().isEmpty());
            assertEquals(2, result.get(1).exposureInfos().size());
        }

        @Test
        @DisplayName("output never exceeds either cap across input sizes")
        void capsHoldForAllSizes() {
            for (int summaries = 0; summaries <= 8; summaries++) {
                List<ExposureSummary> stored = new ArrayList<>();
                for (int s = 0; s < summaries; s++) {
                    stored.add(summary(s + 1, info(s, s * 3), info(s, s * 7 % 11), info(s, 42)));
                }
                for (int maxSummaries = 0; maxSummaries <= 4; maxSummaries++) {
                    for (int maxInfos = 0; maxInfos <= 6; maxInfos++) {
                        List<UploadSummary> result = preparer.prepare(
                            stored, new RiskPolicy(0, maxSummaries, maxInfos), day(20));
                        assertTrue(result.size() <= maxSummaries);
                        assertTrue(totalInfos(result) <= maxInfos);
                    }
                }
            }
        }

        @Test
        @DisplayName("negative caps are treated as zero")
        void negativeCaps() {
            List<ExposureSummary> stored = List.of(summary(3, info(2, 10)));

            assertTrue(preparer.prepare(stored, new RiskPolicy(0, -1, 5), day(4)).isEmpty());

            List<UploadSummary> noInfos = preparer.prepare(stored, new RiskPolicy(0, 1, -3), day(4));
            assertEquals(1, noInfos.size());
            assertTrue(noInfos.get(0).exposureInfos().isEmpty());
        }
    }

    // ── Ranking ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("rankInfos(): ordering")
    class RankingTests {

        @Test
        @DisplayName("higher risk precedes lower risk regardless of date")
        void riskFirst() {
            List<ExposureSummary> selected = List.of(
                summary(9, info(1, 60)),
                summary(8, info(7, 80))
            );

            List<UploadPreparer.TaggedInfo> ranked = UploadPreparer.rankInfos(selected);

            assertEquals(80, ranked.get(0).info().totalRiskScore());
            assertEquals(1, ranked.get(0).summaryIndex());
            assertEquals(60, ranked.get(1).info().totalRiskScore());
        }

        @Test
        @DisplayName("equal risk → older exposure day first")
        void olderDayFirstOnTie() {
            List<ExposureSummary> selected = List.of(summary(9, info(3, 50), info(1, 50)));

            List<UploadPreparer.TaggedInfo> ranked = UploadPreparer.rankInfos(selected);

            assertEquals(day(1), ranked.get(0).info().date());
            assertEquals(day(3), ranked.get(1).info().date());
        }

        @Test
        @DisplayName("summary index is the position in the newest-first selection")
        void indexIsPositional() {
            List<ExposureSummary> selected = UploadPreparer.selectSummaries(List.of(
                summary(1, info(0, 10)),
                summary(3, info(2, 30)),
                summary(2, info(1, 20))
            ), 3);

            List<UploadPreparer.TaggedInfo> ranked = UploadPreparer.rankInfos(selected);

            assertEquals(0, ranked.get(0).summaryIndex()); // risk 30, check day 3
            assertEquals(1, ranked.get(1).summaryIndex()); // risk 20, check day 2
            assertEquals(2, ranked.get(2).summaryIndex()); // risk 10, check day 1
        }
    }

    // ── Conversion ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("upload representation")
    class ConversionTests {

        @Test
        @DisplayName("days since last exposure is measured against the upload server date")
        void stampedWithUploadServerDate() {
            ExposureSummary stored = new ExposureSummary(day(10), day(8), 1, 10, 5, 10, 15, 40, List.of());

            UploadSummary result = preparer.prepare(List.of(stored), new RiskPolicy(0, 1, 1), day(20)).get(0);

            assertEquals(12, result.daysSinceLastExposure());
            assertEquals(LocalDate.of(1970, 1, 11), result.date());
            assertEquals(List.of(5, 10, 15), result.attenuationDurations());
            assertEquals(40, result.riskScoreSum());
        }

        @Test
        @DisplayName("stored summaries are left untouched")
        void inputUnchanged() {
            ExposureSummary stored = summary(5, info(4, 1), info(4, 2), info(4, 3));
            List<ExposureSummary> input = List.of(stored);

            preparer.prepare(input, new RiskPolicy(0, 1, 1), day(6));

            assertEquals(3, input.get(0).exposureInfos().size());
        }
    }
}
