package io.github.drompincen.opsledger.runtime.budget;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * USD prices per million tokens, matched by model-name fragment. The longest
 * matching fragment wins so {@code gpt-4o-mini} is not priced as {@code gpt-4}.
 */
@Component
public class PricingTable {

    public static final int COST_SCALE = 6;

    private static final BigDecimal MILLION = BigDecimal.valueOf(1_000_000);

    public record Price(String fragment, BigDecimal inputPerMillion, BigDecimal outputPerMillion) {
        static Price of(String fragment, String in, String out) {
            return new Price(fragment, new BigDecimal(in), new BigDecimal(out));
        }
    }

    static final Price FREE = Price.of("free", "0", "0");
    static final Price DEFAULT = Price.of("default", "1", "3");

    private static final List<Price> PRICES = List.of(
            Price.of("gpt-4", "30", "60"),
            Price.of("gpt-4-turbo", "10", "30"),
            Price.of("gpt-4o", "5", "15"),
            Price.of("gpt-4o-mini", "0.15", "0.60"),
            Price.of("gpt-3.5-turbo", "0.5", "1.5"),
            Price.of("claude-3-opus", "15", "75"),
            Price.of("claude-3-sonnet", "3", "15"),
            Price.of("claude-3-haiku", "0.25", "1.25"),
            Price.of("claude-3.5-sonnet", "3", "15"),
            Price.of("claude-3-5-sonnet", "3", "15"),
            Price.of("llama-3.1-405b", "3", "3"),
            Price.of("llama-3.1-70b", "0.52", "0.75"),
            Price.of("llama-3.1-8b", "0.06", "0.06"),
            Price.of("mistral-large", "3", "9"),
            Price.of("mistral-medium", "2.7", "8.1"),
            Price.of("mistral-small", "1", "3")
    );

    public Price priceFor(String provider, String model) {
        String p = provider == null ? "" : provider.toLowerCase(Locale.ROOT);
        String m = model == null ? "" : model.toLowerCase(Locale.ROOT);
        if (p.equals("ollama") || p.equals("local") || p.equals("fake") || p.startsWith("cli")
                || m.endsWith(":free") || m.startsWith("cli-")) {
            return FREE;
        }
        return PRICES.stream()
                .filter(price -> m.contains(price.fragment()))
                .max(Comparator.comparingInt(price -> price.fragment().length()))
                .orElse(DEFAULT);
    }

    public BigDecimal cost(String provider, String model, long inputTokens, long outputTokens) {
        Price price = priceFor(provider, model);
        BigDecimal in = BigDecimal.valueOf(Math.max(inputTokens, 0)).multiply(price.inputPerMillion());
        BigDecimal out = BigDecimal.valueOf(Math.max(outputTokens, 0)).multiply(price.outputPerMillion());
        return in.add(out).divide(MILLION, COST_SCALE, RoundingMode.HALF_UP);
    }
}
