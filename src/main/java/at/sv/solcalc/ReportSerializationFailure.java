package at.sv.solcalc;

public final class ReportSerializationFailure extends RuntimeException {
    public ReportSerializationFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
