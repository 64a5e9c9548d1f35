package scadlite.ast.args;

/**
 * Normalized arguments of a primitive call. Fields left null were not given in
 * source; defaults are applied by the code generator, not here.
 */
public sealed interface PrimitiveArgs
        permits CubeArgs, SphereArgs, CylinderArgs, CircleArgs,
        SquareArgs, PolygonArgs, PolyhedronArgs, TextArgs {}
