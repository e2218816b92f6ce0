package com.zzf.bashnorm.tree;

public enum ArgumentType {
    FILE("File"),
    PATTERN("Pattern"),
    NUMBER("Number"),
    SIZE("SizeExp"),
    TIME("TimeExp"),
    PERMISSION("PermissionMode"),
    USERNAME("UserName"),
    GROUPNAME("GroupName"),
    UNKNOWN("Unknown");

    private final String templateName;

    ArgumentType(String templateName) {
        this.templateName = templateName;
    }

    public String templateName() {
        return templateName;
    }
}
