package gabaritodetector;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

import static gabaritodetector.Constants.*;
import static gabaritodetector.DataModels.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ImageNormalizerTest {

    private final ImageNormalizer normalizador = new ImageNormalizer(LayoutConfig.padrao());

    @BeforeAll
    static void carregarOpenCv() {
        Constants.carregarOpenCv();
    }

    @Test
    void resizesToReferenceResolutionAsSingleChannel() throws Exception {
        Mat pequena = FolhaSintetica.folhaBranca(1169, 826, CvType.CV_8UC3);

        NormalizedImage normalizada = normalizador.normalizar(pequena);
        try {
            assertEquals(LARGURA_ESPERADA, normalizada.largura());
            assertEquals(ALTURA_ESPERADA, normalizada.altura());
            assertEquals(1, normalizada.cinza.channels());
        } finally {
            normalizada.release();
            pequena.release();
        }
    }

    @Test
    void normalizingSameBytesTwiceGivesIdenticalBuffers() throws Exception {
        Mat folha = FolhaSintetica.folhaBrancaColorida();
        FolhaSintetica.marcar(folha, 885, 590, 10);
        FolhaSintetica.contorno(folha, 1297, 634, 11);
        byte[] bytes = FolhaSintetica.png(folha);
        folha.release();

        NormalizedImage primeira = normalizador.normalizar(bytes);
        NormalizedImage segunda = normalizador.normalizar(bytes);
        try {
            assertEquals(0.0, Core.norm(primeira.cinza, segunda.cinza, Core.NORM_INF));
        } finally {
            primeira.release();
            segunda.release();
        }
    }

    @Test
    void inputMatIsNotModified() throws Exception {
        Mat folha = FolhaSintetica.folhaBrancaColorida();
        FolhaSintetica.marcar(folha, 885, 590, 10);
        Mat copia = folha.clone();

        normalizador.normalizar(folha).release();

        assertEquals(0.0, Core.norm(folha, copia, Core.NORM_INF));
        folha.release();
        copia.release();
    }

    @Test
    void markStaysDarkAndBackgroundStaysWhite() throws Exception {
        Mat folha = FolhaSintetica.folhaBrancaCinza();
        FolhaSintetica.marcar(folha, 885, 590, 10);

        NormalizedImage normalizada = normalizador.normalizar(folha);
        try {
            assertThat(CircleValidator.intensidadeMedia(normalizada.cinza, 885, 590, 10)).isLessThan(LIMIAR_ESCURIDAO);
            assertThat(CircleValidator.intensidadeMedia(normalizada.cinza, 300, 300, 10)).isGreaterThan(250.0);
        } finally {
            normalizada.release();
            folha.release();
        }
    }

    @Test
    void acceptsBufferedImage() throws Exception {
        BufferedImage imagem = new BufferedImage(LARGURA_ESPERADA / 2, ALTURA_ESPERADA / 2, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = imagem.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, imagem.getWidth(), imagem.getHeight());
        } finally {
            g.dispose();
        }

        NormalizedImage normalizada = normalizador.normalizar(imagem);
        try {
            assertEquals(LARGURA_ESPERADA, normalizada.largura());
            assertEquals(ALTURA_ESPERADA, normalizada.altura());
        } finally {
            normalizada.release();
        }
    }

    @Test
    void corruptBytesFailWithDecodeError() {
        byte[] lixo = "isto nao e uma imagem".getBytes();

        assertThatThrownBy(() -> normalizador.normalizar(lixo)).isInstanceOf(ImageDecodeException.class);
    }

    @Test
    void emptyInputFailsWithDecodeError() {
        assertThatThrownBy(() -> normalizador.normalizar(new byte[0])).isInstanceOf(ImageDecodeException.class);
        assertThatThrownBy(() -> normalizador.normalizar((byte[]) null)).isInstanceOf(ImageDecodeException.class);
        assertThatThrownBy(() -> normalizador.normalizar(new Mat())).isInstanceOf(ImageDecodeException.class);
    }
}
