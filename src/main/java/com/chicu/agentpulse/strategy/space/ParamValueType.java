package com.chicu.agentpulse.strategy.space;

/**
 * Тип значения адаптивного параметра.
 * Диапазон/допустимые значения задаёт {@link ParamSpaceItem}.
 */
public enum ParamValueType {
    INT,
    DECIMAL,
    ENUM
}
