package gabaritodetector;

import java.util.List;

import static gabaritodetector.DataModels.*;

public class DistanceVectorMapper {

    private final ReferenceGrid grade;
    private final double toleranciaPx;

    public DistanceVectorMapper(ReferenceGrid grade, double toleranciaPx) {
        this.grade = grade;
        this.toleranciaPx = toleranciaPx;
    }

    /**
     * Mapeia os círculos validados para questões e alternativas.
     * Cada círculo vai para o ponto de referência válido mais próximo, desde que a distância
     * não passe da tolerância (limite inclusivo). Se a questão já tiver resposta, o círculo é
     * descartado: vale o primeiro círculo processado, na ordem recebida.
     */
    public AnswerMap mapear(List<ValidatedCircle> circulos) {
        AnswerMap respostas = new AnswerMap();
        for (ValidatedCircle circulo : circulos) {
            ReferencePoint melhor = pontoMaisProximo(circulo.x, circulo.y);
            if (melhor != null) {
                respostas.registrar(melhor.numeroQuestao, melhor.alternativa());
            }
        }
        return respostas;
    }

    /**
     * Ponto válido mais próximo de (x, y) dentro da tolerância, ou null.
     * Em caso de empate de distância fica o primeiro na ordem da grade.
     */
    public ReferencePoint pontoMaisProximo(double x, double y) {
        ReferencePoint melhor = null;
        double menorDistancia = Double.POSITIVE_INFINITY;
        for (ReferencePoint ponto : grade.pontosValidos()) {
            double distancia = ponto.distancia(x, y);
            if (distancia < menorDistancia && distancia <= toleranciaPx) {
                menorDistancia = distancia;
                melhor = ponto;
            }
        }
        return melhor;
    }
}
