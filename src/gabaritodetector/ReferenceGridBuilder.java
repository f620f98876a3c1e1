package gabaritodetector;

import static gabaritodetector.Constants.*;
import static gabaritodetector.DataModels.*;

public class ReferenceGridBuilder {

    /**
     * Calcula os pontos fixos de referência de cada questão e alternativa.
     * As questões são distribuídas pelas 5 colunas; as primeiras {@code total % 5} colunas
     * recebem uma questão a mais.
     * @param layout Geometria da folha (mesmo sistema de coordenadas da imagem normalizada).
     * @param totalQuestoes Número de questões desta prova.
     * @return A grade completa (NUM_COLUNAS x maxQuestoesPorColuna x 5 pontos).
     */
    public static ReferenceGrid build(LayoutConfig layout, int totalQuestoes) {
        if (totalQuestoes <= 0 || totalQuestoes > layout.capacidade()) {
            throw new IllegalArgumentException("Total de questões fora do intervalo 1.." + layout.capacidade() + ": " + totalQuestoes);
        }

        int questoesPorColuna = totalQuestoes / NUM_COLUNAS;
        int resto = totalQuestoes % NUM_COLUNAS;
        int maxPorColuna = layout.maxQuestoesPorColuna;

        int[] questoesNaColuna = new int[NUM_COLUNAS];
        ReferencePoint[] pontos = new ReferencePoint[NUM_COLUNAS * maxPorColuna * ALTERNATIVAS.length];

        for (int c = 0; c < NUM_COLUNAS; c++) {
            ColumnRegion regiao = layout.colunas.get(c);
            int limiteColuna = questoesPorColuna + (c < resto ? 1 : 0);
            questoesNaColuna[c] = limiteColuna;
            int yBase = regiao.y + layout.offsetPrimeiraQuestao;

            for (int q = 0; q < maxPorColuna; q++) {
                int yQuestao = yBase + q * layout.espacamentoQuestoes;

                // colunas anteriores com questão extra deslocam a numeração
                int numero = c * questoesPorColuna + q + 1 + Math.min(c, resto);
                if (q >= limiteColuna || numero > totalQuestoes) numero = 0;

                for (int a = 0; a < ALTERNATIVAS.length; a++) {
                    int xAlternativa = regiao.x + a * layout.espacamentoAlternativas;
                    pontos[ReferenceGrid.indice(c, q, a, maxPorColuna)] =
                            new ReferencePoint(c, q, a, xAlternativa, yQuestao, numero);
                }
            }
        }
        return new ReferenceGrid(pontos, questoesNaColuna, maxPorColuna, totalQuestoes);
    }
}
