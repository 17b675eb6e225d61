package io.riskwatch.ingestion.api.model;

import java.util.Map;
import java.util.Set;

/**
 * Risk vocabularies per category and language. Multi-word terms match across any run of whitespace.
 */
public enum KeywordCategory {
    CORRUPTION(Map.of(
            "es", Set.of("corrupción", "soborno", "fraude", "malversación", "cohecho",
                    "comisión ilícita", "conducta indebida", "extorsión", "colusión",
                    "abuso", "estafa", "engaño", "apropiación indebida", "amiguismo",
                    "pago ilícito", "lavado", "blanqueo", "chantaje", "manipulación"),
            "en", Set.of("corruption", "bribery", "fraud", "embezzlement", "graft",
                    "kickback", "misconduct", "extortion", "collusion", "abuse",
                    "scam", "deception", "misappropriation", "cronyism", "payoff",
                    "laundering", "blackmail", "rigging"))),
    FINANCIAL_DISTRESS(Map.of(
            "es", Set.of("quiebra", "insolvencia", "concurso de acreedores", "liquidación",
                    "deuda", "incumplimiento", "deudor", "reestructuración",
                    "procedimiento concursal", "moratoria", "dificultad financiera"),
            "en", Set.of("bankruptcy", "insolvency", "creditors' meeting", "liquidation",
                    "debt", "default", "debtor", "restructuring", "bankruptcy proceedings",
                    "moratorium", "financial distress"))),
    SHAREHOLDING(Map.of(
            "es", Set.of("cambio de accionistas", "transferencia de acciones",
                    "tenencia de acciones", "compra de participaciones"),
            "en", Set.of("change of shareholders", "share transfer", "shareholding",
                    "share purchase"))),
    REGULATORY(Map.of(
            "es", Set.of("sanción", "multa", "expediente sancionador", "infracción",
                    "requerimiento", "apercibimiento", "régimen sancionador", "inspección"),
            "en", Set.of("sanction", "fine", "penalty", "infringement", "enforcement action",
                    "regulatory breach", "inspection", "cease and desist"))),
    DISMISSAL(Map.of(
            "es", Set.of("despido colectivo", "despido", "regulación de empleo",
                    "reducción de plantilla", "expediente de regulación"),
            "en", Set.of("collective dismissal", "layoff", "layoffs", "employment regulation",
                    "workforce reduction", "redundancies"))),
    ENVIRONMENTAL(Map.of(
            "es", Set.of("contaminación", "emisiones", "vertido", "gestión de residuos",
                    "impacto ambiental", "greenwashing", "delito ambiental"),
            "en", Set.of("pollution", "emissions", "spill", "waste management",
                    "environmental impact", "greenwashing", "environmental crime"))),
    OPERATIONAL(Map.of(
            "es", Set.of("nombramiento", "cese", "dimisión", "ampliación de capital",
                    "reducción de capital", "junta general", "fusión", "escisión", "cambio de domicilio"),
            "en", Set.of("appointment", "resignation", "capital increase", "capital reduction",
                    "general meeting", "merger", "spin-off", "change of registered office")));

    private final Map<String, Set<String>> termsByLanguage;

    KeywordCategory(Map<String, Set<String>> termsByLanguage) {
        this.termsByLanguage = termsByLanguage;
    }

    public Set<String> terms(String language) {
        return termsByLanguage.getOrDefault(language, Set.of());
    }
}
