package fr.lapetina.llm.tuner.middleware;

/**
 * Throttle settings.
 *
 * @param rps   Maximum call starts per second
 * @param burst Burst size; reported but spacing stays steady-state
 */
public record ThrottleOptions(double rps, int burst) {

    public ThrottleOptions {
        if (rps <= 0) {
            throw new IllegalArgumentException("rps must be positive: " + rps);
        }
    }

    public static ThrottleOptions of(double rps) {
        return new ThrottleOptions(rps, (int) Math.ceil(2 * rps));
    }

    public static ThrottleOptions defaults() {
        return of(3);
    }
}
