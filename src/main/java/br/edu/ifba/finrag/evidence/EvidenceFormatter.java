package br.edu.ifba.finrag.evidence;

import br.edu.ifba.finrag.metrics.DeltaMetric;
import br.edu.ifba.finrag.metrics.FinancialSummary;
import br.edu.ifba.finrag.metrics.TrendResult;
import br.edu.ifba.finrag.retrieval.Citation;
import br.edu.ifba.finrag.retrieval.EvidenceBundle;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Numbers retrieval citations and metric facts into one footnote list.
 *
 * <p>Order: citations in rank order, then deltas with at least one defined field, then
 * trends with a known direction. Numbering restarts at 1 for every report.</p>
 */
public class EvidenceFormatter {

    private static final Logger logger = LoggerFactory.getLogger(EvidenceFormatter.class);

    public EvidenceReport format(@NotNull EvidenceBundle bundle, @Nullable FinancialSummary summary) {
        List<Footnote> footnotes = new ArrayList<>();

        for (Citation citation : bundle.citations()) {
            footnotes.add(new Footnote(footnotes.size() + 1, FootnoteKind.CITATION,
                citation.source(), citationText(citation)));
        }

        if (summary != null) {
            for (DeltaMetric delta : summary.deltas()) {
                if (delta.hasAnyValue()) {
                    footnotes.add(new Footnote(footnotes.size() + 1, FootnoteKind.DELTA,
                        summary.company() + " " + delta.concept() + " " + delta.period(),
                        deltaText(summary.company(), delta)));
                }
            }
            for (TrendResult trend : summary.trends()) {
                if (trend.isKnown()) {
                    footnotes.add(new Footnote(footnotes.size() + 1, FootnoteKind.TREND,
                        summary.company() + " " + trend.concept(),
                        trendText(summary.company(), trend)));
                }
            }
        }

        logger.debug("Formatted {} footnotes for query '{}'", footnotes.size(), bundle.query());
        return new EvidenceReport(bundle.query(), bundle.context(), summary, footnotes);
    }

    private static String citationText(Citation citation) {
        StringBuilder text = new StringBuilder();
        text.append('"').append(citation.snippet()).append("\" (");
        if (citation.company() != null) {
            text.append(citation.company());
            if (citation.period() != null) {
                text.append(' ').append(citation.period());
            }
            text.append("; ");
        }
        text.append(citation.source())
            .append(String.format(Locale.ROOT, "; relevance %.2f)", citation.relevanceScore()));
        return text.toString();
    }

    private static String deltaText(String company, DeltaMetric delta) {
        StringBuilder text = new StringBuilder()
            .append(company).append(' ').append(delta.concept()).append(' ').append(delta.period())
            .append(": ").append(String.format(Locale.ROOT, "%,.2f", delta.value()));
        appendPercent(text, "QoQ", delta.qoqPct());
        appendPercent(text, "YoY", delta.yoyPct());
        if (delta.derivedRatio() != null) {
            text.append(String.format(Locale.ROOT, ", gross margin %.2f%%", delta.derivedRatio() * 100));
        }
        return text.toString();
    }

    private static void appendPercent(StringBuilder text, String label, @Nullable Double value) {
        text.append(", ").append(label).append(' ');
        if (value == null) {
            text.append("n/a");
        } else {
            text.append(String.format(Locale.ROOT, "%+.2f%%", value));
        }
    }

    private static String trendText(String company, TrendResult trend) {
        return String.format(Locale.ROOT,
            "%s %s trend %s over %d periods (slope %.2f per period, R² %.2f, p %.3f, next %.2f)",
            company, trend.concept(), trend.direction().label(), trend.sampleSize(),
            trend.slope(), trend.rSquared(), trend.pValue(), trend.forecastNext());
    }
}
