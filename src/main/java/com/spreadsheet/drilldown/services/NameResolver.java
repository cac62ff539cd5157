package com.spreadsheet.drilldown.services;

import com.spreadsheet.drilldown.models.AiSuggestion;
import com.spreadsheet.drilldown.models.CellNameOverride;
import com.spreadsheet.drilldown.models.NameComponents;
import com.spreadsheet.drilldown.models.NameSource;
import com.spreadsheet.drilldown.models.NamingMode;
import com.spreadsheet.drilldown.models.ResolvedName;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Picks a display name from the layered sources of one cell.
 * Each mode walks its tiers top-down and the first tier with data wins.
 * FALLBACK always has data, so resolution never fails.
 */
@Service
public class NameResolver {

    private static final Map<NamingMode, List<NameSource>> PRECEDENCE = new EnumMap<>(NamingMode.class);

    static {
        PRECEDENCE.put(NamingMode.COMPONENT,
                List.of(NameSource.MANUAL, NameSource.COMPONENT, NameSource.FALLBACK));
        PRECEDENCE.put(NamingMode.GENERATED,
                List.of(NameSource.MANUAL, NameSource.MANUAL_EDIT, NameSource.AI,
                        NameSource.COMPONENT_FALLBACK, NameSource.FALLBACK));
    }

    public static List<NameSource> precedence(NamingMode mode) {
        return PRECEDENCE.get(mode);
    }

    /**
     * @param rawReference qualified cell reference, used by the FALLBACK tier
     * @param override     everything known about the cell, or null when nothing is
     */
    public ResolvedName resolve(String rawReference, CellNameOverride override, NamingMode mode) {
        NameComponents components = override == null
                ? new NameComponents(null, null, null)
                : new NameComponents(override.getContextText(), override.getRowValueLabel(),
                override.getColumnValueLabel());

        for (NameSource tier : PRECEDENCE.get(mode)) {
            ResolvedName resolved = attempt(tier, rawReference, override, components);
            if (resolved != null) {
                return resolved;
            }
        }
        throw new IllegalStateException("No fallback tier for mode " + mode);
    }

    private ResolvedName attempt(NameSource tier, String rawReference, CellNameOverride override,
                                 NameComponents components) {
        switch (tier) {
            case MANUAL:
                if (override != null && hasText(override.getManualName())) {
                    return new ResolvedName(override.getManualName().trim(), tier, null, components);
                }
                return null;
            case MANUAL_EDIT:
                if (override != null && override.isManuallyEdited()) {
                    return new ResolvedName(override.getEditedName().trim(), tier, null, components);
                }
                return null;
            case AI:
                AiSuggestion suggestion = override == null ? null : override.getAiSuggestion();
                if (suggestion != null && suggestion.isUsable()) {
                    return new ResolvedName(suggestion.getSuggestedName().trim(), tier,
                            suggestion.getConfidence(), components);
                }
                return null;
            case COMPONENT:
            case COMPONENT_FALLBACK:
                String joined = components.join();
                return joined == null ? null : new ResolvedName(joined, tier, null, components);
            case FALLBACK:
                return new ResolvedName(rawReference, tier, null, components);
            default:
                return null;
        }
    }

    private static boolean hasText(String text) {
        return text != null && !text.isBlank();
    }
}
