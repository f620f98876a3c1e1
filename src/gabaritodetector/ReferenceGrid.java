package gabaritodetector;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static gabaritodetector.Constants.*;
import static gabaritodetector.DataModels.*;

/**
 * Tabela imutável de pontos de referência, indexada por (coluna, questão na coluna, alternativa)
 * num array plano. Segura para leitura concorrente depois de construída.
 */
public class ReferenceGrid {

    private final ReferencePoint[] pontos;
    private final List<ReferencePoint> pontosValidos;
    private final int[] questoesPorColuna;
    private final int maxQuestoesPorColuna;
    private final int totalQuestoes;

    ReferenceGrid(ReferencePoint[] pontos, int[] questoesPorColuna, int maxQuestoesPorColuna, int totalQuestoes) {
        this.pontos = pontos;
        this.questoesPorColuna = questoesPorColuna;
        this.maxQuestoesPorColuna = maxQuestoesPorColuna;
        this.totalQuestoes = totalQuestoes;

        List<ReferencePoint> validos = new ArrayList<>();
        for (ReferencePoint p : pontos) {
            if (p.isValido()) validos.add(p);
        }
        this.pontosValidos = Collections.unmodifiableList(validos);
    }

    static int indice(int coluna, int questaoNaColuna, int indiceAlternativa, int maxQuestoesPorColuna) {
        return (coluna * maxQuestoesPorColuna + questaoNaColuna) * ALTERNATIVAS.length + indiceAlternativa;
    }

    public ReferencePoint get(int coluna, int questaoNaColuna, int indiceAlternativa) {
        if (coluna < 0 || coluna >= NUM_COLUNAS
                || questaoNaColuna < 0 || questaoNaColuna >= maxQuestoesPorColuna
                || indiceAlternativa < 0 || indiceAlternativa >= ALTERNATIVAS.length) {
            throw new IndexOutOfBoundsException("Posição fora da grade: coluna=" + coluna
                    + ", questao=" + questaoNaColuna + ", alternativa=" + indiceAlternativa);
        }
        return pontos[indice(coluna, questaoNaColuna, indiceAlternativa, maxQuestoesPorColuna)];
    }

    /** Todos os pontos, inclusive posições sem questão correspondente. */
    public List<ReferencePoint> pontos() {
        return Collections.unmodifiableList(Arrays.asList(pontos));
    }

    public List<ReferencePoint> pontosValidos() {
        return pontosValidos;
    }

    public int questoesNaColuna(int coluna) {
        return questoesPorColuna[coluna];
    }

    /** Número global da questão, ou 0 se a posição estiver além do limite da coluna. */
    public int numeroQuestao(int coluna, int questaoNaColuna) {
        return get(coluna, questaoNaColuna, 0).numeroQuestao;
    }

    public int totalQuestoes() {
        return totalQuestoes;
    }
}
