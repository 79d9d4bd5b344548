package com.ryuqq.watchdog.core.model;

/**
 * 진단 details 값.
 *
 * <p>문자열, 정수, 불리언, 실수 네 가지로 닫힌 타입입니다.</p>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
public sealed interface DetailValue
    permits DetailValue.Text, DetailValue.Int, DetailValue.Bool, DetailValue.Decimal {

    /**
     * 로깅/요약용 원시 값.
     *
     * @return String, Long, Boolean, Double 중 하나
     */
    Object raw();

    static DetailValue of(String value) {
        return new Text(value);
    }

    static DetailValue of(long value) {
        return new Int(value);
    }

    static DetailValue of(boolean value) {
        return new Bool(value);
    }

    static DetailValue of(double value) {
        return new Decimal(value);
    }

    /**
     * 문자열 값.
     *
     * @param value 값 (null 불가)
     */
    record Text(String value) implements DetailValue {
        public Text {
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null");
            }
        }

        @Override
        public Object raw() {
            return value;
        }

        @Override
        public String toString() {
            return value;
        }
    }

    /**
     * 정수 값.
     *
     * @param value 값
     */
    record Int(long value) implements DetailValue {
        @Override
        public Object raw() {
            return value;
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    /**
     * 불리언 값.
     *
     * @param value 값
     */
    record Bool(boolean value) implements DetailValue {
        @Override
        public Object raw() {
            return value;
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    /**
     * 실수 값.
     *
     * @param value 값
     */
    record Decimal(double value) implements DetailValue {
        @Override
        public Object raw() {
            return value;
        }

        @Override
        public String toString() {
            return Double.toString(value);
        }
    }
}
