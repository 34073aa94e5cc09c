package com.merlt.orchestrator.weights;

import java.util.Locale;

/**
 * Relation types of the legal knowledge graph that experts traverse.
 */
public final class RelationTypes {
    public static final String DEFINES = "DEFINES";
    public static final String REFERS_TO = "REFERS_TO";
    public static final String CONTAINS = "CONTAINS";
    public static final String REGULATES = "REGULATES";
    public static final String MODIFIES = "MODIFIES";
    public static final String REPEALS = "REPEALS";
    public static final String DEROGATES = "DEROGATES";
    public static final String CONNECTED_TO = "CONNECTED_TO";
    public static final String IMPLEMENTS = "IMPLEMENTS";
    public static final String EXPRESSES_PRINCIPLE = "EXPRESSES_PRINCIPLE";
    public static final String CONSTITUTIONAL_BASIS = "CONSTITUTIONAL_BASIS";
    public static final String EU_SOURCE = "EU_SOURCE";
    public static final String PURPOSE = "PURPOSE";
    public static final String PROTECTS = "PROTECTS";
    public static final String INTERPRETS = "INTERPRETS";
    public static final String APPLIES = "APPLIES";
    public static final String CITES = "CITES";
    public static final String CONFIRMS = "CONFIRMS";
    public static final String COMMENTS = "COMMENTS";
    public static final String OVERRULES = "OVERRULES";
    public static final String CONFLICTS_WITH = "CONFLICTS_WITH";

    private RelationTypes() {
    }

    public static String normalize(String relationType) {
        if (relationType == null) {
            return "";
        }
        return relationType.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
    }
}
