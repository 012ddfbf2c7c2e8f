package com.williamcallahan.skillcatalog.service.trending;

import com.williamcallahan.skillcatalog.domain.StarSnapshot;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Keeps per-record star history bounded at {@value #MAX_SNAPSHOTS} points.
 *
 * <p>Over the cap, the kept points are: first and last, the last seven days, Sundays within
 * eight weeks, first-of-month points before that, and points that moved more than 10% from
 * their predecessor. If that still exceeds the cap, the first point plus the most recent
 * others are kept.</p>
 */
@Component
public class SnapshotCompressor {
    public static final int MAX_SNAPSHOTS = 20;

    private static final long DAILY_WINDOW_DAYS = 7;
    private static final long WEEKLY_WINDOW_DAYS = 56;
    private static final double SIGNIFICANT_CHANGE = 0.1;

    /**
     * Appends today's star count when it differs from the last point, then compresses.
     *
     * @param snapshots existing history, oldest first
     * @param stars current stars
     * @param today current UTC date
     * @return updated history
     */
    public List<StarSnapshot> record(List<StarSnapshot> snapshots, int stars, LocalDate today) {
        List<StarSnapshot> history = new ArrayList<>(snapshots == null ? List.of() : snapshots);
        if (history.isEmpty() || history.get(history.size() - 1).stars() != stars) {
            history.add(StarSnapshot.of(today, stars));
        }
        return compress(history, today);
    }

    /**
     * Compresses a history; lists within the cap are returned unchanged.
     */
    public List<StarSnapshot> compress(List<StarSnapshot> snapshots, LocalDate today) {
        if (snapshots.size() <= MAX_SNAPSHOTS) {
            return List.copyOf(snapshots);
        }
        int lastIndex = snapshots.size() - 1;
        List<StarSnapshot> kept = new ArrayList<>();
        for (int index = 0; index <= lastIndex; index++) {
            StarSnapshot snapshot = snapshots.get(index);
            StarSnapshot previous = index > 0 ? snapshots.get(index - 1) : null;
            if (index == 0 || index == lastIndex || shouldKeep(snapshot, previous, today)) {
                kept.add(snapshot);
            }
        }
        if (kept.size() <= MAX_SNAPSHOTS) {
            return List.copyOf(kept);
        }
        List<StarSnapshot> bounded = new ArrayList<>(MAX_SNAPSHOTS);
        bounded.add(kept.get(0));
        bounded.addAll(kept.subList(kept.size() - (MAX_SNAPSHOTS - 1), kept.size()));
        return List.copyOf(bounded);
    }

    private static boolean shouldKeep(StarSnapshot snapshot, StarSnapshot previous, LocalDate today) {
        LocalDate date = snapshot.localDate();
        long ageDays = ChronoUnit.DAYS.between(date, today);
        if (ageDays <= DAILY_WINDOW_DAYS) {
            return true;
        }
        if (ageDays <= WEEKLY_WINDOW_DAYS && date.getDayOfWeek() == DayOfWeek.SUNDAY) {
            return true;
        }
        if (ageDays > WEEKLY_WINDOW_DAYS && date.getDayOfMonth() == 1) {
            return true;
        }
        return previous != null
                && previous.stars() > 0
                && Math.abs(snapshot.stars() - previous.stars()) / (double) previous.stars() > SIGNIFICANT_CHANGE;
    }
}
