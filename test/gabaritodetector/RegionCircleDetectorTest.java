package gabaritodetector;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.opencv.core.Mat;
import java.util.ArrayList;
import java.util.List;

import static gabaritodetector.DataModels.*;
import static gabaritodetector.FolhaSintetica.*;
import static org.assertj.core.api.Assertions.assertThat;

class RegionCircleDetectorTest {

    private Mat cinza;
    private NormalizedImage imagem;

    @BeforeAll
    static void carregarOpenCv() {
        Constants.carregarOpenCv();
    }

    @BeforeEach
    void setUp() {
        cinza = folhaBrancaCinza();
        imagem = new NormalizedImage(cinza);
    }

    @AfterEach
    void tearDown() {
        imagem.release();
    }

    @Test
    void detectsDiskWithAbsoluteCoordinates() {
        marcar(cinza, xAlternativa(0, 1), yQuestao(0, 0), 10);

        List<CandidateCircle> candidatos = new RegionCircleDetector(LayoutConfig.padrao(), DetectorParams.padrao()).detectar(imagem);

        assertThat(candidatos).isNotEmpty();
        assertThat(candidatos).allSatisfy(c -> {
            assertThat(c.coluna).isEqualTo(0);
            assertThat(c.x).isBetween(885 - 3, 885 + 3);
            assertThat(c.y).isBetween(590 - 3, 590 + 3);
            assertThat(c.raio).isBetween(8, 14);
        });
    }

    @Test
    void candidatesAreTaggedWithSourceColumnInColumnOrder() {
        marcar(cinza, xAlternativa(3, 2), yQuestao(3, 5), 10);
        marcar(cinza, xAlternativa(1, 3), yQuestao(1, 2), 10);

        List<CandidateCircle> candidatos = new RegionCircleDetector(LayoutConfig.padrao(), DetectorParams.padrao()).detectar(imagem);

        assertThat(candidatos).allSatisfy(c -> assertThat(c.coluna).isIn(1, 3));
        assertThat(candidatos.get(0).coluna).isEqualTo(1);
        assertThat(candidatos.get(candidatos.size() - 1).coluna).isEqualTo(3);
        assertThat(candidatos).anySatisfy(c -> {
            assertThat(c.x).isBetween(xAlternativa(3, 2) - 3, xAlternativa(3, 2) + 3);
            assertThat(c.y).isBetween(yQuestao(3, 5) - 3, yQuestao(3, 5) + 3);
        });
    }

    @Test
    void blankSheetHasNoCandidates() {
        List<CandidateCircle> candidatos = new RegionCircleDetector(LayoutConfig.padrao(), DetectorParams.padrao()).detectar(imagem);

        assertThat(candidatos).isEmpty();
    }

    @Test
    void diskOutsideEveryColumnIsIgnored() {
        marcar(cinza, 300, 300, 10);

        List<CandidateCircle> candidatos = new RegionCircleDetector(LayoutConfig.padrao(), DetectorParams.padrao()).detectar(imagem);

        assertThat(candidatos).isEmpty();
    }

    @Test
    void regionOutsideImageIsSkippedAndOthersStillDetected() {
        LayoutConfig padrao = LayoutConfig.padrao();
        List<ColumnRegion> colunas = new ArrayList<>(padrao.colunas);
        colunas.set(4, new ColumnRegion(2300, 580, 210, 860));
        LayoutConfig layout = new LayoutConfig(padrao.larguraEsperada, padrao.alturaEsperada, colunas,
                padrao.espacamentoQuestoes, padrao.espacamentoAlternativas,
                padrao.offsetPrimeiraQuestao, padrao.maxQuestoesPorColuna);
        marcar(cinza, xAlternativa(0, 2), yQuestao(0, 3), 10);

        List<CandidateCircle> candidatos = new RegionCircleDetector(layout, DetectorParams.padrao()).detectar(imagem);

        assertThat(candidatos).isNotEmpty();
        assertThat(candidatos).allSatisfy(c -> assertThat(c.coluna).isEqualTo(0));
    }
}
