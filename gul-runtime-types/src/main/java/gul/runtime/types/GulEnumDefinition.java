package gul.runtime.types;

import gul.runtime.GulValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 枚举定义，保存各变体的原始声明文本
 */
public final class GulEnumDefinition extends GulValue {

    private final String name;
    private final List<String> variantTexts;
    private final Map<String, GulEnumVariant> variants = new LinkedHashMap<String, GulEnumVariant>();

    public GulEnumDefinition(String name, List<String> variantTexts) {
        this.name = name;
        this.variantTexts = new ArrayList<String>(variantTexts);
        for (String text : variantTexts) {
            String variant = variantName(text);
            if (!variant.isEmpty()) {
                variants.put(variant, new GulEnumVariant(name, variant));
            }
        }
    }

    public String getName() {
        return name;
    }

    public List<String> getVariantTexts() {
        return Collections.unmodifiableList(variantTexts);
    }

    public List<String> getVariantNames() {
        return new ArrayList<String>(variants.keySet());
    }

    /** 不存在返回 null */
    public GulEnumVariant getVariant(String variantName) {
        return variants.get(variantName);
    }

    @Override
    public String getTypeName() {
        return "enum";
    }

    @Override
    public String render() {
        return "<enum " + name + ">";
    }

    // "Ident(int)"、"Plus = 1"、"Eof," → 变体名
    static String variantName(String text) {
        String t = text.trim();
        int end = 0;
        while (end < t.length() && (Character.isLetterOrDigit(t.charAt(end)) || t.charAt(end) == '_')) {
            end++;
        }
        return t.substring(0, end);
    }
}
