package dev.careeriq.service;

import dev.careeriq.config.AnalysisTuning;
import dev.careeriq.model.ExperienceLevel;
import dev.careeriq.model.RoleCatalog;
import dev.careeriq.model.RoleProfile;
import dev.careeriq.util.DurationParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides which catalog role a job description targets and what seniority it expects.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RoleDetectionService {

    private static final List<Pattern> SENIOR_MARKERS = List.of(
            Pattern.compile("\\bsenior\\b"), Pattern.compile("\\bsr\\.?\\s"),
            Pattern.compile("\\b(?:tech|technical|team)\\s+lead\\b"),
            Pattern.compile("\\blead\\s+(?:engineer|developer|programmer|architect|analyst|scientist)\\b"),
            Pattern.compile("\\bprincipal\\b"), Pattern.compile("\\barchitect\\b"), Pattern.compile("\\bstaff engineer\\b"));
    private static final List<Pattern> ENTRY_MARKERS = List.of(
            Pattern.compile("\\bjunior\\b"), Pattern.compile("\\bjr\\.?\\s"), Pattern.compile("\\bentry[- ]level\\b"),
            Pattern.compile("\\bgraduate\\b"), Pattern.compile("\\bintern(ship)?\\b"), Pattern.compile("\\bfresher\\b"));

    private final RoleCatalog roleCatalog;
    private final AnalysisTuning tuning;

    /**
     * The hinted role when it names a catalog role; otherwise the role whose detection
     * keywords occur most often in the job text (catalog order breaks ties); otherwise the
     * catalog default.
     */
    public RoleProfile detectRole(String jobDescription, String hint) {
        if (hint != null && !hint.isBlank()) {
            Optional<RoleProfile> hinted = roleCatalog.find(hint);
            if (hinted.isPresent()) {
                return hinted.get();
            }
            log.debug("Role hint does not name a known role, detecting from job text");
        }

        if (jobDescription == null || jobDescription.isBlank()) {
            return roleCatalog.defaultProfile();
        }

        String lower = jobDescription.toLowerCase(Locale.ROOT);
        RoleProfile best = null;
        int bestHits = 0;
        for (RoleProfile role : roleCatalog.getRoles()) {
            int hits = role.keywordHits(lower);
            if (hits > bestHits) {
                best = role;
                bestHits = hits;
            }
        }
        return best != null ? best : roleCatalog.defaultProfile();
    }

    /**
     * Seniority the job asks for. Explicit seniority words win, the earliest one when the
     * text carries both kinds ("Junior developer ... mentored by our tech lead"); then an
     * "N+ years" requirement mapped through the experience thresholds; then the role's default.
     */
    public ExperienceLevel expectedLevel(String jobDescription, RoleProfile role) {
        if (jobDescription == null || jobDescription.isBlank()) {
            return role.expectedLevel();
        }
        String lower = jobDescription.toLowerCase(Locale.ROOT);
        int senior = firstMatch(SENIOR_MARKERS, lower);
        int entry = firstMatch(ENTRY_MARKERS, lower);
        if (senior >= 0 || entry >= 0) {
            boolean seniorFirst = entry < 0 || (senior >= 0 && senior < entry);
            return seniorFirst ? ExperienceLevel.SENIOR : ExperienceLevel.ENTRY;
        }
        OptionalInt years = DurationParser.maxYearsMentioned(lower);
        if (years.isPresent()) {
            return tuning.expectedLevelForYears(years.getAsInt());
        }
        return role.expectedLevel();
    }

    /** Offset of the earliest marker in the text, or -1. */
    private static int firstMatch(List<Pattern> markers, String text) {
        int first = -1;
        for (Pattern marker : markers) {
            Matcher matcher = marker.matcher(text);
            if (matcher.find() && (first < 0 || matcher.start() < first)) {
                first = matcher.start();
            }
        }
        return first;
    }
}
