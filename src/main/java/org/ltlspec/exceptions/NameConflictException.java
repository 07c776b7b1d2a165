package org.ltlspec.exceptions;

import lombok.Getter;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * 候选名称与已有变量名或某个枚举定义域中的取值重名。
 */
@Getter
public class NameConflictException extends SpecException {

    /**
     * 冲突的来源。
     */
    public enum Kind {
        VARIABLE,
        VALUE
    }

    private final Set<String> names;
    private final Kind kind;

    public NameConflictException(Set<String> names, Kind kind) {
        super((kind == Kind.VARIABLE ? "变量被重复定义: " : "取值被重复定义: ") + new TreeSet<>(names));
        this.names = Collections.unmodifiableSet(new TreeSet<>(names));
        this.kind = kind;
    }
}
