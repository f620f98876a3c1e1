package gabaritodetector;

import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static gabaritodetector.Constants.*;
import static gabaritodetector.DataModels.*;

public class ConfigLoader {

    /**
     * Lê o template da folha (seções [LAYOUT], [COLUNAS] e [DETECTOR]).
     * Chaves ausentes assumem os valores padrão de {@link Constants}.
     * @return O template, ou null se o arquivo não puder ser lido ou estiver mal formatado.
     */
    public static FolhaTemplate loadTemplate(String caminhoTemplate) {
        try (Reader reader = new FileReader(caminhoTemplate, StandardCharsets.UTF_8)) {
            return loadTemplate(reader);
        } catch (IOException e) {
            System.err.println("Erro ao ler template: " + e.getMessage());
            return null;
        }
    }

    /** Template embutido no jar (layout CONAB). */
    public static FolhaTemplate loadDefaultTemplate() {
        InputStream in = ConfigLoader.class.getResourceAsStream(RESOURCE_LAYOUT_PADRAO);
        if (in == null) {
            System.err.println("Erro ao ler template: recurso " + RESOURCE_LAYOUT_PADRAO + " não encontrado");
            return null;
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return loadTemplate(reader);
        } catch (IOException e) {
            System.err.println("Erro ao ler template: " + e.getMessage());
            return null;
        }
    }

    public static FolhaTemplate loadTemplate(Reader origem) {
        int largura = LARGURA_ESPERADA, altura = ALTURA_ESPERADA;
        int espQuestoes = ESPACAMENTO_QUESTOES, espAlternativas = ESPACAMENTO_ALTERNATIVAS, offset = OFFSET_PRIMEIRA_QUESTAO;
        int maxPorColuna = MAX_QUESTOES_POR_COLUNA;
        List<ColumnRegion> colunas = new ArrayList<>();
        int raioMin = RAIO_MINIMO, raioMax = RAIO_MAXIMO;
        double param1 = HOUGH_PARAM1, param2 = HOUGH_PARAM2, distMin = DISTANCIA_MINIMA;
        double escuridao = LIMIAR_ESCURIDAO, circularidade = LIMIAR_CIRCULARIDADE, tolerancia = TOLERANCIA_PX;
        boolean verificarCircularidade = VERIFICAR_CIRCULARIDADE;

        String secao = null;
        int numeroLinha = 0;
        try (BufferedReader br = new BufferedReader(origem)) {
            String line;
            while ((line = br.readLine()) != null) {
                numeroLinha++;
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                if (line.startsWith("[")) {
                    secao = line.replace("[", "").replace("]", "").trim().toUpperCase();
                    continue;
                }
                int sep = line.indexOf(':');
                if (secao == null || sep < 0) {
                    System.err.println("⚠ Aviso: linha " + numeroLinha + " ignorada no template: " + line);
                    continue;
                }
                String chave = line.substring(0, sep).trim().toUpperCase();
                String[] partes = line.substring(sep + 1).trim().split(";");

                switch (secao + "." + chave) {
                    case "LAYOUT.DIMENSOES":
                        exigirCampos(partes, 2, chave);
                        largura = inteiro(partes[0]);
                        altura = inteiro(partes[1]);
                        break;
                    case "LAYOUT.ESPACAMENTOS":
                        exigirCampos(partes, 3, chave);
                        espQuestoes = inteiro(partes[0]);
                        espAlternativas = inteiro(partes[1]);
                        offset = inteiro(partes[2]);
                        break;
                    case "LAYOUT.MAX_QUESTOES_COLUNA":
                        maxPorColuna = inteiro(partes[0]);
                        break;
                    case "COLUNAS.COLUNA":
                        exigirCampos(partes, 4, chave);
                        colunas.add(new ColumnRegion(inteiro(partes[0]), inteiro(partes[1]),
                                inteiro(partes[2]), inteiro(partes[3])));
                        break;
                    case "DETECTOR.RAIO":
                        exigirCampos(partes, 2, chave);
                        raioMin = inteiro(partes[0]);
                        raioMax = inteiro(partes[1]);
                        break;
                    case "DETECTOR.HOUGH":
                        exigirCampos(partes, 3, chave);
                        param1 = decimal(partes[0]);
                        param2 = decimal(partes[1]);
                        distMin = decimal(partes[2]);
                        break;
                    case "DETECTOR.LIMIAR_ESCURIDAO":
                        escuridao = decimal(partes[0]);
                        break;
                    case "DETECTOR.CIRCULARIDADE":
                        circularidade = decimal(partes[0]);
                        if (partes.length > 1) verificarCircularidade = Boolean.parseBoolean(partes[1].trim());
                        break;
                    case "DETECTOR.TOLERANCIA":
                        tolerancia = decimal(partes[0]);
                        break;
                    default:
                        System.err.println("⚠ Aviso: chave desconhecida '" + chave + "' na seção [" + secao + "]");
                }
            }

            if (colunas.isEmpty()) {
                for (int[] r : REGIOES_COLUNAS) colunas.add(new ColumnRegion(r[0], r[1], r[2], r[3]));
            }
            LayoutConfig layout = new LayoutConfig(largura, altura, colunas, espQuestoes, espAlternativas, offset, maxPorColuna);
            DetectorParams parametros = new DetectorParams(raioMin, raioMax, param1, param2, distMin,
                    escuridao, circularidade, verificarCircularidade, tolerancia);
            return new FolhaTemplate(layout, parametros);
        } catch (IOException e) {
            System.err.println("Erro ao ler template: " + e.getMessage());
        } catch (NumberFormatException e) {
            System.err.println("Erro de formato de número no template (linha " + numeroLinha + "): " + e.getMessage());
        } catch (IllegalArgumentException e) {
            System.err.println("Template inválido: " + e.getMessage());
        }
        return null;
    }

    /**
     * Lê o gabarito oficial: uma linha {@code numero;LETRA} por questão
     * ({@code ANULADA} para questões anuladas).
     * @return Mapa ordenado por questão; vazio se o arquivo não puder ser lido.
     */
    public static Map<Integer, String> loadGabarito(String caminhoGabarito) {
        Map<Integer, String> gabarito = new TreeMap<>();
        try (BufferedReader br = new BufferedReader(new FileReader(caminhoGabarito, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#") || line.startsWith("[")) continue;
                String[] partes = line.split(";");
                if (partes.length == 2) {
                    gabarito.put(Integer.parseInt(partes[0].trim()), partes[1].trim().toUpperCase());
                } else {
                    System.err.println("⚠ Aviso: linha mal formatada no gabarito: " + line);
                }
            }
        } catch (IOException e) {
            System.err.println("Erro ao ler gabarito: " + e.getMessage());
            gabarito.clear();
        } catch (NumberFormatException e) {
            System.err.println("Erro de formato de número no gabarito: " + e.getMessage());
            gabarito.clear();
        }
        return gabarito;
    }

    private static void exigirCampos(String[] partes, int esperados, String chave) {
        if (partes.length != esperados) {
            throw new IllegalArgumentException("'" + chave + "' espera " + esperados + " campos, encontrados " + partes.length);
        }
    }

    private static int inteiro(String valor) {
        return Integer.parseInt(valor.trim());
    }

    private static double decimal(String valor) {
        return Double.parseDouble(valor.trim());
    }
}
