package com.realm.simulation.persistence;

/**
 * 存档格式
 */
public enum SnapshotFormat {

    JSON(".json"),
    YAML(".yaml");

    public static final String GZIP_SUFFIX = ".gz";

    private final String extension;

    SnapshotFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    public String fileName(String name, boolean compressed) {
        return name + extension + (compressed ? GZIP_SUFFIX : "");
    }

    /**
     * 按文件名推断格式，无法识别时返回 null
     */
    public static SnapshotFormat detect(String fileName) {
        String plain = fileName.endsWith(GZIP_SUFFIX)
            ? fileName.substring(0, fileName.length() - GZIP_SUFFIX.length())
            : fileName;
        for (SnapshotFormat format : values()) {
            if (plain.endsWith(format.extension)) {
                return format;
            }
        }
        return null;
    }

    public static SnapshotFormat parse(String value) {
        if (value == null || value.isEmpty()) {
            return JSON;
        }
        for (SnapshotFormat format : values()) {
            if (format.name().equalsIgnoreCase(value) || format.extension.equals("." + value.toLowerCase())) {
                return format;
            }
        }
        throw new IllegalArgumentException("不支持的存档格式: " + value);
    }
}
