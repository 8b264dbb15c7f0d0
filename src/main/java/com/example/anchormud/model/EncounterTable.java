package com.example.anchormud.model;

import java.util.Collections;
import java.util.List;

/**
 * Random encounter table for a zone. A d100 roll selects one row; the row's
 * members are spawned together under a shared encounter id.
 */
public class EncounterTable {

    public record Member(String templateId, int minCount, int maxCount) {
        public Member {
            if (templateId == null) throw new IllegalArgumentException("encounter member needs a template");
            if (minCount < 1) minCount = 1;
            if (maxCount < minCount) maxCount = minCount;
        }
    }

    /**
     * Inclusive d100 band.
     */
    public record Row(int minRoll, int maxRoll, List<Member> members) {
        public Row {
            members = members == null ? Collections.emptyList() : List.copyOf(members);
        }

        public boolean matches(int roll) {
            return roll >= minRoll && roll <= maxRoll;
        }
    }

    private final String zoneId;
    private final List<Row> rows;

    public EncounterTable(String zoneId, List<Row> rows) {
        this.zoneId = zoneId;
        this.rows = rows == null ? Collections.emptyList() : List.copyOf(rows);
    }

    public String getZoneId() { return zoneId; }
    public List<Row> getRows() { return rows; }

    /**
     * @return the row covering the d100 roll, or null when no row does
     */
    public Row select(int roll) {
        for (Row r : rows) {
            if (r.matches(roll)) return r;
        }
        return null;
    }
}
