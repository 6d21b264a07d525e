package tidalharmonics.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Contenedor principal para todas las configuraciones del motor de predicción.
 * Agrupa los parámetros numéricos del refinamiento de extremos, la memoización
 * de factores nodales y el muestreo paralelo.
 */
@Value
@Builder
@With
public class PredictionConfig {

    /**
     * Aplica las correcciones nodales (f, u). Si es false se usa la corrección identidad.
     */
    @Builder.Default
    boolean nodalCorrectionsEnabled = true;

    /**
     * Intervalo de muestreo por defecto para las series (minutos).
     */
    @Builder.Default
    double defaultIntervalMinutes = 6.0;

    /**
     * Anchura del intervalo de bisección por debajo de la cual se considera refinado un extremo (segundos).
     */
    @Builder.Default
    double extremaToleranceSeconds = 60.0;

    /**
     * Tope de iteraciones de la bisección. Al alcanzarlo se devuelve la mejor estimación.
     */
    @Builder.Default
    int extremaMaxIterations = 50;

    /**
     * Semiancho de la diferencia central usada para estimar la pendiente (segundos).
     */
    @Builder.Default
    double slopeProbeSeconds = 30.0;

    /**
     * Tamaño del cubo temporal para memoizar factores nodales (segundos). 0 desactiva la caché.
     */
    @Builder.Default
    long nodalCacheBucketSeconds = 0L;

    /**
     * Número máximo de entradas de la caché nodal antes de vaciarla.
     */
    @Builder.Default
    int nodalCacheMaxEntries = 4096;

    /**
     * Distancia a J2000 (años) a partir de la cual las efemérides se marcan como de confianza reducida.
     */
    @Builder.Default
    double ephemerisValidityYears = 200.0;

    /**
     * Número de hilos del muestreador paralelo.
     */
    @Builder.Default
    int workerThreads = Runtime.getRuntime().availableProcessors();

    /**
     * Configuración por defecto del motor.
     */
    public static PredictionConfig defaults() {
        return PredictionConfig.builder().build();
    }

    public boolean isNodalCacheEnabled() {
        return nodalCacheBucketSeconds > 0;
    }
}
