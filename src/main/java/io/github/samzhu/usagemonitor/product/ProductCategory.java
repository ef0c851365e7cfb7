package io.github.samzhu.usagemonitor.product;

/**
 * 產品分類，用於報表分組。
 */
public enum ProductCategory {
    COMPUTE("Compute"),
    STORAGE("Storage"),
    NETWORK("Application Services"),
    SECURITY("Security"),
    MEDIA("Media"),
    AI("AI & ML"),
    CONNECTIVITY("Zero Trust & Connectivity"),
    PLATFORM("Platform Services");

    private final String displayName;

    ProductCategory(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
