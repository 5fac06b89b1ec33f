package gul.runtime.types;

import gul.runtime.GulValue;

/**
 * 枚举变体值，按枚举名与变体名相等
 */
public final class GulEnumVariant extends GulValue {

    private final String enumName;
    private final String variantName;

    public GulEnumVariant(String enumName, String variantName) {
        this.enumName = enumName;
        this.variantName = variantName;
    }

    public String getEnumName() {
        return enumName;
    }

    public String getVariantName() {
        return variantName;
    }

    @Override
    public String getTypeName() {
        return enumName;
    }

    @Override
    public String render() {
        return enumName + "." + variantName;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof GulEnumVariant)) {
            return false;
        }
        GulEnumVariant other = (GulEnumVariant) obj;
        return enumName.equals(other.enumName) && variantName.equals(other.variantName);
    }

    @Override
    public int hashCode() {
        return enumName.hashCode() * 31 + variantName.hashCode();
    }
}
