package work.robolab.sketch.board;

import java.util.List;

/**
 * Pins a board exposes: digital and PWM pins by number, analog pins by name ({@code A0}...).
 */
public record PinCapabilities(List<Integer> digital, List<Integer> pwm, List<String> analog) {
    public PinCapabilities {
        digital = digital == null ? List.of() : List.copyOf(digital);
        pwm = pwm == null ? List.of() : List.copyOf(pwm);
        analog = analog == null ? List.of() : List.copyOf(analog);
    }

    public static PinCapabilities none() {
        return new PinCapabilities(List.of(), List.of(), List.of());
    }
}
