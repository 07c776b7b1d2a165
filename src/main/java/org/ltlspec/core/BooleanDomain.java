package org.ltlspec.core;

/**
 * 布尔定义域 (单例)。
 */
public final class BooleanDomain extends Domain {

    public static final BooleanDomain INSTANCE = new BooleanDomain();

    private BooleanDomain() {
    }

    @Override
    public Kind getKind() {
        return Kind.BOOLEAN;
    }

    @Override
    public String toString() {
        return "boolean";
    }
}
