package im.arun.tlfextract.classify;

import static org.assertj.core.api.Assertions.assertThat;

import im.arun.tlfextract.model.PageText;
import im.arun.tlfextract.model.TlfIdentity;
import im.arun.tlfextract.model.TlfKind;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class PageClassifierTest {

    private final PageClassifier classifier = new PageClassifier();

    @Test
    void readsHeadingTitlePopulationAndSourceProgram() {
        PageText page = PageText.of(43, String.join("\n",
                "Table 14.1.1",
                "Demographics",
                "Population: Safety",
                "Age (years)      45.2      44.8",
                "Source:   prog1.sas   02JUN2023"));

        Optional<TlfIdentity> identity = classifier.classify(page);

        assertThat(identity).contains(new TlfIdentity("Table 14.1.1", TlfKind.TABLE, "Demographics", "Safety", "prog1.sas"));
    }

    @Test
    void classifiesFigureHeadingsCaseInsensitively() {
        PageText page = PageText.of(50, "  FIGURE 14.2-3.1  \nKaplan-Meier Plot of Time to Event");

        TlfIdentity identity = classifier.classify(page).orElseThrow();

        assertThat(identity.getId()).isEqualTo("FIGURE 14.2-3.1");
        assertThat(identity.getKind()).isEqualTo(TlfKind.FIGURE);
        assertThat(identity.getTitle()).isEqualTo("Kaplan-Meier Plot of Time to Event");
        assertThat(identity.getPopulation()).isNull();
        assertThat(identity.getSourceProgram()).isNull();
    }

    @Test
    void acceptsHeadingWithoutSpaceBeforeSectionNumber() {
        assertThat(classifier.classify(PageText.of(43, "Table14.3.2\nAdverse Events"))).isPresent();
    }

    @Test
    void headingPaddedWithNonBreakingSpacesIsRecognised() {
        PageText page = PageText.of(43, "\u00A0Table 14.1.1\u00A0\n\u202FDemographics\u2007\nPopulation:\u00A0Safety");

        TlfIdentity identity = classifier.classify(page).orElseThrow();

        assertThat(identity.getId()).isEqualTo("Table 14.1.1");
        assertThat(identity.getTitle()).isEqualTo("Demographics");
        assertThat(identity.getPopulation()).isEqualTo("Safety");
        assertThat(classifier.isHeading("\u00A0\u00A0Figure\u00A014.2.1")).isTrue();
    }

    @Test
    void nonBreakingSpaceLinesDoNotCountTowardsHeadingWindow() {
        String text = "\u00A0\n".repeat(12) + "Table 14.1.1\n\u00A0 \u00A0\nDemographics";

        PageText page = PageText.of(43, text);
        TlfIdentity identity = classifier.classify(page).orElseThrow();

        assertThat(page.getLines()).containsExactly("Table 14.1.1", "Demographics");
        assertThat(identity.getTitle()).isEqualTo("Demographics");
    }

    @Test
    void sourceProgramSplitsOnNonBreakingColumnGap() {
        PageText page = PageText.of(43, "Table 14.1.1\nDemographics\nSource:\u00A0t_dm.sas\u00A0\u00A002JUN2023");

        assertThat(classifier.classify(page).orElseThrow().getSourceProgram()).isEqualTo("t_dm.sas");
    }

    @Test
    void ignoresHeadingsOutsideSection14() {
        assertThat(classifier.classify(PageText.of(43, "Table 15.1\nReferences"))).isEmpty();
        assertThat(classifier.classify(PageText.of(43, "Table 14\nNo subsection"))).isEmpty();
        assertThat(classifier.classify(PageText.of(43, "Listing 16.2.1\nSubject listing"))).isEmpty();
    }

    @Test
    void ignoresHeadingBelowTheTenthLine() {
        StringBuilder text = new StringBuilder();
        for (int i = 1; i <= 10; i++) {
            text.append("Row ").append(i).append('\n');
        }
        text.append("Table 14.1.1\nDemographics");

        assertThat(classifier.classify(PageText.of(43, text.toString()))).isEmpty();
    }

    @Test
    void blankLinesDoNotCountTowardsHeadingWindow() {
        String text = "\n\n\n\n\n\n\n\n\n\n\n\nTable 14.1.1\n\n\nDemographics";

        TlfIdentity identity = classifier.classify(PageText.of(43, text)).orElseThrow();

        assertThat(identity.getTitle()).isEqualTo("Demographics");
    }

    @Test
    void firstHeadingWins() {
        PageText page = PageText.of(43, "Table 14.1.1\nDemographics\nTable 14.1.2\nBaseline");

        assertThat(classifier.classify(page).orElseThrow().getId()).isEqualTo("Table 14.1.1");
    }

    @Test
    void titleIsEmptyWhenHeadingIsLastLine() {
        TlfIdentity identity = classifier.classify(PageText.of(43, "Table 14.1.1")).orElseThrow();

        assertThat(identity.getTitle()).isEmpty();
    }

    @Test
    void sourceProgramIsTakenFromTheLowestFooterLine() {
        PageText page = PageText.of(43, String.join("\n",
                "Table 14.1.1",
                "Demographics",
                "Source: early.sas",
                "body",
                "SOURCE: late.sas  Run 01JAN2024"));

        assertThat(classifier.classify(page).orElseThrow().getSourceProgram()).isEqualTo("late.sas");
    }

    @Test
    void sourceProgramOutsideFooterWindowIsIgnored() {
        StringBuilder text = new StringBuilder("Table 14.1.1\nDemographics\nSource: top.sas\n");
        for (int i = 1; i <= 15; i++) {
            text.append("Row ").append(i).append('\n');
        }

        assertThat(classifier.classify(PageText.of(43, text.toString())).orElseThrow().getSourceProgram()).isNull();
    }

    @Test
    void emptySourceLineYieldsNoProgram() {
        PageText page = PageText.of(43, "Table 14.1.1\nDemographics\nSource:");

        assertThat(classifier.classify(page).orElseThrow().getSourceProgram()).isNull();
    }

    @Test
    void populationKeepsTextAfterFirstColon() {
        PageText page = PageText.of(43, "Table 14.1.1\nDemographics\npopulation:  ITT: all randomized ");

        assertThat(classifier.classify(page).orElseThrow().getPopulation()).isEqualTo("ITT: all randomized");
    }

    @Test
    void classificationIsIdempotent() {
        PageText page = PageText.of(44, "Figure 14.2.1\nMean Change\nPopulation: FAS\nSource: f1.sas  x");

        assertThat(classifier.classify(page)).isEqualTo(classifier.classify(page));
    }
}
