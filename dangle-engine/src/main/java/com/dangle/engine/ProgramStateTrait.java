package com.dangle.engine;

/**
 * 检查器在 {@link ProgramState} 中保存数据所用的键。按实例身份区分。
 *
 * @param <T> 值类型（必须不可变）
 */
public final class ProgramStateTrait<T> {
    private final String name;
    private final T defaultValue;

    public ProgramStateTrait(String name, T defaultValue) {
        this.name = name;
        this.defaultValue = defaultValue;
    }

    public String getName() {
        return name;
    }

    public T getDefaultValue() {
        return defaultValue;
    }

    @Override
    public String toString() {
        return name;
    }
}
