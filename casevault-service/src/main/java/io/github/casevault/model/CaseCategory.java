package io.github.casevault.model;

public enum CaseCategory {
    CRIMINAL_LAW,
    CIVIL_LAW,
    CORPORATE_LAW,
    FAMILY_LAW,
    IMMIGRATION_LAW,
    INTELLECTUAL_PROPERTY,
    LABOR_LAW,
    REAL_ESTATE,
    TAX_LAW,
    OTHER
}
