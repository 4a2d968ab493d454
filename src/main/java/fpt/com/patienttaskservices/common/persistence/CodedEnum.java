package fpt.com.patienttaskservices.common.persistence;

/**
 * Enum whose constants are stored and serialized under a fixed code
 * that is not a valid Java identifier ("X-RAY", "Ward Male").
 */
public interface CodedEnum {

    String getCode();

    static <E extends Enum<E> & CodedEnum> E fromCode(Class<E> type, String code) {
        if (code == null) {
            return null;
        }
        for (E constant : type.getEnumConstants()) {
            if (constant.getCode().equalsIgnoreCase(code.trim())) {
                return constant;
            }
        }
        throw new IllegalArgumentException("Unknown " + type.getSimpleName() + ": " + code);
    }
}
