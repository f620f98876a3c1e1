package gabaritodetector;

import org.opencv.core.Mat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static gabaritodetector.Constants.*;

public class DataModels {

    /** Retângulo de uma coluna de questões, em coordenadas da imagem normalizada. */
    public static class ColumnRegion {
        public final int x, y, w, h;

        public ColumnRegion(int x, int y, int w, int h) {
            if (w <= 0 || h <= 0) {
                throw new IllegalArgumentException("Região de coluna com tamanho inválido: " + w + "x" + h);
            }
            this.x = x; this.y = y; this.w = w; this.h = h;
        }

        public boolean cabeEm(int largura, int altura) {
            return x >= 0 && y >= 0 && x + w <= largura && y + h <= altura;
        }

        @Override
        public String toString() {
            return "{x=" + x + ", y=" + y + ", w=" + w + ", h=" + h + "}";
        }
    }

    /**
     * Geometria fixa da folha. Construída uma vez e compartilhada (somente leitura)
     * por todos os componentes.
     */
    public static class LayoutConfig {
        public final int larguraEsperada, alturaEsperada;
        public final List<ColumnRegion> colunas;
        public final int espacamentoQuestoes, espacamentoAlternativas, offsetPrimeiraQuestao;
        public final int maxQuestoesPorColuna;

        public LayoutConfig(int larguraEsperada, int alturaEsperada, List<ColumnRegion> colunas,
                            int espacamentoQuestoes, int espacamentoAlternativas,
                            int offsetPrimeiraQuestao, int maxQuestoesPorColuna) {
            if (larguraEsperada <= 0 || alturaEsperada <= 0) {
                throw new IllegalArgumentException("Dimensões esperadas inválidas: " + larguraEsperada + "x" + alturaEsperada);
            }
            if (colunas == null || colunas.size() != NUM_COLUNAS) {
                throw new IllegalArgumentException("O layout precisa de exatamente " + NUM_COLUNAS + " colunas");
            }
            if (maxQuestoesPorColuna <= 0) {
                throw new IllegalArgumentException("Máximo de questões por coluna inválido: " + maxQuestoesPorColuna);
            }
            this.larguraEsperada = larguraEsperada;
            this.alturaEsperada = alturaEsperada;
            this.colunas = Collections.unmodifiableList(new ArrayList<>(colunas));
            this.espacamentoQuestoes = espacamentoQuestoes;
            this.espacamentoAlternativas = espacamentoAlternativas;
            this.offsetPrimeiraQuestao = offsetPrimeiraQuestao;
            this.maxQuestoesPorColuna = maxQuestoesPorColuna;
        }

        public int capacidade() {
            return NUM_COLUNAS * maxQuestoesPorColuna;
        }

        public static LayoutConfig padrao() {
            List<ColumnRegion> regioes = new ArrayList<>();
            for (int[] r : REGIOES_COLUNAS) {
                regioes.add(new ColumnRegion(r[0], r[1], r[2], r[3]));
            }
            return new LayoutConfig(LARGURA_ESPERADA, ALTURA_ESPERADA, regioes,
                    ESPACAMENTO_QUESTOES, ESPACAMENTO_ALTERNATIVAS, OFFSET_PRIMEIRA_QUESTAO,
                    MAX_QUESTOES_POR_COLUNA);
        }
    }

    /** Parâmetros do detector de bolhas e do mapeamento. */
    public static class DetectorParams {
        public final int raioMinimo, raioMaximo;
        public final double param1, param2, distanciaMinima;
        public final double limiarEscuridao;
        public final double limiarCircularidade;
        public final boolean verificarCircularidade;
        public final double toleranciaPx;

        public DetectorParams(int raioMinimo, int raioMaximo, double param1, double param2,
                              double distanciaMinima, double limiarEscuridao,
                              double limiarCircularidade, boolean verificarCircularidade,
                              double toleranciaPx) {
            if (raioMinimo <= 0 || raioMaximo < raioMinimo) {
                throw new IllegalArgumentException("Faixa de raio inválida: [" + raioMinimo + ", " + raioMaximo + "]");
            }
            this.raioMinimo = raioMinimo; this.raioMaximo = raioMaximo;
            this.param1 = param1; this.param2 = param2; this.distanciaMinima = distanciaMinima;
            this.limiarEscuridao = limiarEscuridao;
            this.limiarCircularidade = limiarCircularidade;
            this.verificarCircularidade = verificarCircularidade;
            this.toleranciaPx = toleranciaPx;
        }

        public static DetectorParams padrao() {
            return new DetectorParams(RAIO_MINIMO, RAIO_MAXIMO, HOUGH_PARAM1, HOUGH_PARAM2,
                    DISTANCIA_MINIMA, LIMIAR_ESCURIDAO, LIMIAR_CIRCULARIDADE,
                    VERIFICAR_CIRCULARIDADE, TOLERANCIA_PX);
        }
    }

    public static class FolhaTemplate {
        public final LayoutConfig layout;
        public final DetectorParams parametros;

        public FolhaTemplate(LayoutConfig layout, DetectorParams parametros) {
            this.layout = layout;
            this.parametros = parametros;
        }
    }

    public static class ReferencePoint {
        public final int coluna, questaoNaColuna, indiceAlternativa;
        public final int x, y;
        // 0 quando a posição não pertence a nenhuma questão da prova
        public final int numeroQuestao;

        public ReferencePoint(int coluna, int questaoNaColuna, int indiceAlternativa, int x, int y, int numeroQuestao) {
            this.coluna = coluna; this.questaoNaColuna = questaoNaColuna;
            this.indiceAlternativa = indiceAlternativa;
            this.x = x; this.y = y;
            this.numeroQuestao = numeroQuestao;
        }

        public String alternativa() {
            return ALTERNATIVAS[indiceAlternativa];
        }

        public boolean isValido() {
            return numeroQuestao > 0;
        }

        public double distancia(double px, double py) {
            double dx = px - x;
            double dy = py - y;
            return Math.sqrt(dx * dx + dy * dy);
        }

        @Override
        public String toString() {
            return "Q" + numeroQuestao + alternativa() + " (" + x + ", " + y + ")";
        }
    }

    public static class CandidateCircle {
        public final int x, y, raio;
        public final int coluna;

        public CandidateCircle(int x, int y, int raio, int coluna) {
            this.x = x; this.y = y; this.raio = raio; this.coluna = coluna;
        }

        @Override
        public String toString() {
            return "(" + x + ", " + y + ") r=" + raio + " col=" + coluna;
        }
    }

    public static class ValidatedCircle {
        public final int x, y, raio;
        public final int coluna;
        public final double intensidadeMedia;

        public ValidatedCircle(CandidateCircle candidato, double intensidadeMedia) {
            this(candidato.x, candidato.y, candidato.raio, candidato.coluna, intensidadeMedia);
        }

        public ValidatedCircle(int x, int y, int raio, int coluna, double intensidadeMedia) {
            this.x = x; this.y = y; this.raio = raio; this.coluna = coluna;
            this.intensidadeMedia = intensidadeMedia;
        }

        @Override
        public String toString() {
            return "(" + x + ", " + y + ") r=" + raio + String.format(" media=%.1f", intensidadeMedia);
        }
    }

    /** Buffer em tons de cinza na resolução de referência. Pertence a uma única execução. */
    public static class NormalizedImage {
        public final Mat cinza;

        public NormalizedImage(Mat cinza) {
            this.cinza = cinza;
        }

        public int largura() { return cinza.cols(); }

        public int altura() { return cinza.rows(); }

        public void release() {
            if (cinza != null) cinza.release();
        }
    }

    /** Resultado completo de uma leitura, para diagnóstico. Chame release() ao terminar. */
    public static class DetectionResult {
        public final NormalizedImage normalizada;
        public final ReferenceGrid grade;
        public final List<CandidateCircle> candidatos;
        public final List<ValidatedCircle> validados;
        public final AnswerMap respostas;

        public DetectionResult(NormalizedImage normalizada, ReferenceGrid grade, List<CandidateCircle> candidatos,
                               List<ValidatedCircle> validados, AnswerMap respostas) {
            this.normalizada = normalizada;
            this.grade = grade;
            this.candidatos = Collections.unmodifiableList(candidatos);
            this.validados = Collections.unmodifiableList(validados);
            this.respostas = respostas;
        }

        public void release() {
            if (normalizada != null) normalizada.release();
        }
    }

    public static class ComparisonResult {
        public final int acertos, erros, naoRespondidas, anuladas;

        public ComparisonResult(int acertos, int erros, int naoRespondidas, int anuladas) {
            this.acertos = acertos; this.erros = erros;
            this.naoRespondidas = naoRespondidas; this.anuladas = anuladas;
        }

        public int total() {
            return acertos + erros + naoRespondidas + anuladas;
        }

        @Override
        public String toString() {
            return "Acertos: " + acertos + ", Erros: " + erros +
                   ", Não respondidas: " + naoRespondidas + ", Anuladas: " + anuladas;
        }
    }
}
