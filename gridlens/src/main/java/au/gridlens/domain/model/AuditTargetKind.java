package au.gridlens.domain.model;

public enum AuditTargetKind {
    ENTITY,
    SOURCE
}
