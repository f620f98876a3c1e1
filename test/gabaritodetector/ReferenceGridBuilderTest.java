package gabaritodetector;

import org.junit.jupiter.api.Test;
import java.util.HashSet;
import java.util.Set;

import static gabaritodetector.Constants.*;
import static gabaritodetector.DataModels.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ReferenceGridBuilderTest {

    private final LayoutConfig layout = LayoutConfig.padrao();

    @Test
    void columnCountsDifferByAtMostOneAndSumToTotal() {
        for (int total = 1; total <= layout.capacidade(); total++) {
            ReferenceGrid grade = ReferenceGridBuilder.build(layout, total);
            int soma = 0;
            for (int c = 0; c < NUM_COLUNAS; c++) {
                int n = grade.questoesNaColuna(c);
                assertThat(n).isBetween(total / NUM_COLUNAS, total / NUM_COLUNAS + 1);
                soma += n;
            }
            assertEquals(total, soma, "Soma das colunas para total=" + total);
        }
    }

    @Test
    void everyQuestionNumberAppearsExactlyOncePerAlternative() {
        for (int total : new int[]{1, 7, 60, 62, 84, 100, 125}) {
            ReferenceGrid grade = ReferenceGridBuilder.build(layout, total);
            Set<Integer> numeros = new HashSet<>();
            for (ReferencePoint p : grade.pontosValidos()) {
                if (p.indiceAlternativa == 0) {
                    assertThat(numeros.add(p.numeroQuestao)).isTrue();
                }
            }
            assertThat(numeros).hasSize(total);
            assertThat(numeros).allSatisfy(n -> assertThat(n).isBetween(1, total));
            assertThat(grade.pontosValidos()).hasSize(total * ALTERNATIVAS.length);
        }
    }

    @Test
    void firstQuestionAlternativeBSitsOneSpacingRightOfColumnOrigin() {
        ReferenceGrid grade = ReferenceGridBuilder.build(layout, 60);

        ReferencePoint b = grade.get(0, 0, 1);

        assertEquals(842 + 43, b.x);
        assertEquals(580 + 10, b.y);
        assertEquals(1, b.numeroQuestao);
        assertEquals("B", b.alternativa());
    }

    @Test
    void remainderGivesExtraQuestionToLeadingColumns() {
        // 62 = 5 * 12 + 2: as colunas 1 e 2 ficam com 13 questões
        ReferenceGrid grade = ReferenceGridBuilder.build(layout, 62);

        assertEquals(13, grade.questoesNaColuna(0));
        assertEquals(13, grade.questoesNaColuna(1));
        assertEquals(12, grade.questoesNaColuna(2));
        assertEquals(13, grade.numeroQuestao(0, 12));
        assertEquals(14, grade.numeroQuestao(1, 0));
        assertEquals(26, grade.numeroQuestao(1, 12));
        assertEquals(27, grade.numeroQuestao(2, 0));
        assertEquals(62, grade.numeroQuestao(4, 11));
    }

    @Test
    void positionsBeyondColumnLimitAreInvalid() {
        ReferenceGrid grade = ReferenceGridBuilder.build(layout, 62);

        assertEquals(0, grade.numeroQuestao(2, 12));
        assertEquals(0, grade.numeroQuestao(4, 12));
        assertEquals(0, grade.numeroQuestao(0, 24));
        assertThat(grade.get(4, 12, 3).isValido()).isFalse();
        // a grade continua completa, só sem número de questão
        assertThat(grade.pontos()).hasSize(NUM_COLUNAS * MAX_QUESTOES_POR_COLUNA * ALTERNATIVAS.length);
    }

    @Test
    void questionRowsFollowVerticalSpacing() {
        ReferenceGrid grade = ReferenceGridBuilder.build(layout, 100);

        ReferencePoint p = grade.get(3, 7, 4);

        assertEquals(1683 + 4 * 43, p.x);
        assertEquals(580 + 10 + 7 * 44, p.y);
        assertEquals(3 * 20 + 7 + 1, p.numeroQuestao);
    }

    @Test
    void rejectsTotalOutsideSheetCapacity() {
        assertThatThrownBy(() -> ReferenceGridBuilder.build(layout, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ReferenceGridBuilder.build(layout, layout.capacidade() + 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void lookupOutsideGridThrows() {
        ReferenceGrid grade = ReferenceGridBuilder.build(layout, 60);

        assertThatThrownBy(() -> grade.get(5, 0, 0)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> grade.get(0, 25, 0)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> grade.get(0, 0, 5)).isInstanceOf(IndexOutOfBoundsException.class);
    }
}
