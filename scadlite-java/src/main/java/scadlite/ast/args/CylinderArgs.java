package scadlite.ast.args;

public record CylinderArgs(
        Double h,
        Double r,
        Double r1,
        Double r2,
        Boolean center,
        Double fn,
        Double fa,
        Double fs
) implements PrimitiveArgs {}
