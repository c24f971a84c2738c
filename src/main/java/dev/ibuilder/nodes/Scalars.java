package dev.ibuilder.nodes;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Path;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Factories for the leaf nodes of the supported scalar types.
 */
public final class Scalars {

    static final String INTEGER_PROMPT = "Type an integer";
    static final String NUMBER_PROMPT = "Type a number";
    static final String STRING_PROMPT = "Type a string";
    static final String CHAR_PROMPT = "Type a char";
    static final String PATH_PROMPT = "Type a path";

    private static final Pattern INTEGER = Pattern.compile("[+-]?[0-9]+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?([0-9]+\\.?[0-9]*|\\.[0-9]+)([eE][+-]?[0-9]+)?");
    private static final Pattern SPECIAL_FLOAT = Pattern.compile("([+-]?)(inf|infinity|nan)", Pattern.CASE_INSENSITIVE);

    private Scalars() {}

    public static NodeFactory<Byte> int8() {
        return scalar(text -> Byte.valueOf(integerText(text)), INTEGER_PROMPT);
    }

    public static NodeFactory<Short> int16() {
        return scalar(text -> Short.valueOf(integerText(text)), INTEGER_PROMPT);
    }

    public static NodeFactory<Integer> int32() {
        return scalar(text -> Integer.valueOf(integerText(text)), INTEGER_PROMPT);
    }

    public static NodeFactory<Long> int64() {
        return scalar(text -> Long.valueOf(integerText(text)), INTEGER_PROMPT);
    }

    public static NodeFactory<BigInteger> bigInteger() {
        return scalar(text -> new BigInteger(integerText(text)), INTEGER_PROMPT);
    }

    public static NodeFactory<Float> float32() {
        return scalar(text -> Float.valueOf(floatText(text)), NUMBER_PROMPT);
    }

    public static NodeFactory<Double> float64() {
        return scalar(text -> Double.valueOf(floatText(text)), NUMBER_PROMPT);
    }

    public static NodeFactory<BigDecimal> decimal() {
        return scalar(text -> new BigDecimal(decimalText(text)), NUMBER_PROMPT);
    }

    public static NodeFactory<String> string() {
        return scalar(text -> text, STRING_PROMPT);
    }

    /**
     * A single UTF-16 {@code char}. Characters outside the Basic Multilingual Plane (most emoji)
     * take two chars and are rejected as "too many characters in string"; use {@link #string()}
     * for them.
     */
    public static NodeFactory<Character> character() {
        return scalar(Scalars::parseChar, CHAR_PROMPT);
    }

    public static NodeFactory<Path> path() {
        return scalar(Path::of, PATH_PROMPT);
    }

    public static NodeFactory<Boolean> bool() {
        return BooleanNode::new;
    }

    /** A leaf for any type with a textual form, e.g. an enum or a {@code java.time} value. */
    public static <T> NodeFactory<T> scalar(ScalarNode.Parser<T> parser, String defaultPrompt) {
        return scalar(parser, String::valueOf, defaultPrompt);
    }

    public static <T> NodeFactory<T> scalar(ScalarNode.Parser<T> parser, Function<T, String> formatter,
                                            String defaultPrompt) {
        return config -> new ScalarNode<>(parser, formatter, config.promptOr(defaultPrompt), config.defaultValue());
    }

    // numbers accept plain ASCII syntax only
    private static String integerText(String text) {
        if (text.isEmpty()) {
            throw new NumberFormatException("cannot parse integer from empty string");
        }
        if (!INTEGER.matcher(text).matches()) {
            throw new NumberFormatException("invalid digit found in string");
        }
        return text;
    }

    private static String floatText(String text) {
        Matcher special = SPECIAL_FLOAT.matcher(text);
        if (special.matches()) {
            return special.group(1) + (special.group(2).equalsIgnoreCase("nan") ? "NaN" : "Infinity");
        }
        return decimalText(text);
    }

    private static String decimalText(String text) {
        if (text.isEmpty()) {
            throw new NumberFormatException("cannot parse float from empty string");
        }
        if (!DECIMAL.matcher(text).matches()) {
            throw new NumberFormatException("invalid float literal");
        }
        return text;
    }

    private static Character parseChar(String text) {
        if (text.isEmpty()) {
            throw new IllegalArgumentException("cannot parse char from empty string");
        }
        if (text.length() > 1) {
            throw new IllegalArgumentException("too many characters in string");
        }
        return text.charAt(0);
    }
}
