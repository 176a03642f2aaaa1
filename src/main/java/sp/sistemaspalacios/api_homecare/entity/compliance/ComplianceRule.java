package sp.sistemaspalacios.api_homecare.entity.compliance;

/**
 * Códigos de regla devueltos en cada {@code ComplianceIssue}, con la referencia legal
 * que se muestra al empleador.
 */
public enum ComplianceRule {
    SHIFT_OVERLAP("Une seule intervention à la fois par auxiliaire"),
    ABSENCE_CONFLICT("Aucune intervention pendant une absence approuvée"),
    DAILY_REST("Repos quotidien minimum de 11h consécutives (Art. L3131-1 Code du travail)"),
    WEEKLY_REST("Repos hebdomadaire minimum de 35h consécutives (Art. L3132-2 Code du travail)"),
    WEEKLY_MAX_HOURS("Durée maximale de travail de 48h par semaine (Art. L3121-20 Code du travail)"),
    CONTRACT_HOURS_EXCEEDED("Heures au-delà de la durée contractuelle : heures supplémentaires"),
    DAILY_MAX_HOURS("Durée maximale de travail de 10h par jour (Art. L3121-18 Code du travail)"),
    MANDATORY_BREAK("Pause de 20 min obligatoire après 6h de travail (Art. L3121-16 Code du travail)"),
    NIGHT_PRESENCE_MAX_DURATION("Présence responsable de nuit limitée à 12h consécutives (Art. 148 IDCC 3239)"),
    CONSECUTIVE_NIGHTS_MAX("Maximum 5 nuits consécutives de présence responsable (Art. 148 IDCC 3239)"),
    GUARD_24H_EFFECTIVE_MAX("Garde 24h : 12h de travail effectif maximum (Art. L3121-18 Code du travail)"),
    GUARD_MAX_AMPLITUDE("Amplitude d'une garde (effectif + présence) limitée à 24h (IDCC 3239)");

    private final String legalReference;

    ComplianceRule(String legalReference) {
        this.legalReference = legalReference;
    }

    public String getLegalReference() {
        return legalReference;
    }
}
