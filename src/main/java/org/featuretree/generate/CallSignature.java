package org.featuretree.generate;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * 已知 CadQuery 方法的位置参数槽位。
 * <p>
 * 位置参数优先取 {@code arg_i}，其次取槽位别名中第一个尚未使用的参数；
 * 必填槽位缺值时使用默认值，可选槽位只有在后面的槽位有值时才补位。
 *
 * @param method 方法名
 * @param slots  位置参数槽位，按方法签名顺序
 */
record CallSignature(String method, List<Slot> slots) {

    /**
     * @param aliases        可以填入该槽位的参数名
     * @param defaultLiteral 缺值时的默认字面量；可选槽位为 null
     */
    record Slot(List<String> aliases, String defaultLiteral) {

        boolean required() {
            return defaultLiteral != null;
        }
    }

    private static final Map<String, CallSignature> KNOWN = Map.ofEntries(
            entry("Workplane", required("'XY'", "plane", "inPlane")),
            entry("workplane", optional("offset")),
            entry("circle", required("5", "radius")),
            entry("rect", required("1", "xLen", "width", "length"), required("1", "yLen", "height", "width")),
            entry("ellipse", required("1", "x_radius", "radius"), required("1", "y_radius")),
            entry("polygon", required("6", "nSides", "sides"), required("1", "diameter")),
            entry("polyline", optional("listOfXYTuple", "points")),
            entry("spline", optional("listOfXYTuple", "points")),
            entry("slot2D", required("1", "length"), required("1", "diameter")),
            entry("extrude", required("1", "until", "distance", "depth", "height")),
            entry("revolve", required("360", "angleDegrees", "angle")),
            entry("sweep", optional("path")),
            entry("box", required("1", "length", "width"), required("1", "width", "height"),
                    required("1", "height", "depth")),
            entry("cylinder", required("1", "height"), required("1", "radius")),
            entry("sphere", required("1", "radius")),
            entry("fillet", required("0.1", "radius")),
            entry("chamfer", required("0.1", "length", "distance")),
            entry("mirror", optional("mirrorPlane", "plane")),
            entry("rarray", required("1", "xSpacing", "spacing"), required("1", "ySpacing"),
                    required("1", "xCount", "count"), required("1", "yCount")),
            entry("polarArray", required("1", "radius"), required("0", "startAngle"),
                    required("360", "angle"), required("1", "count")));

    static CallSignature forMethod(String method) {
        CallSignature known = KNOWN.get(method);
        return known != null ? known : new CallSignature(method, List.of());
    }

    private static Map.Entry<String, CallSignature> entry(String method, Slot... slots) {
        return Map.entry(method, new CallSignature(method, Arrays.asList(slots)));
    }

    private static Slot required(String defaultLiteral, String... aliases) {
        return new Slot(List.of(aliases), defaultLiteral);
    }

    private static Slot optional(String... aliases) {
        return new Slot(List.of(aliases), null);
    }
}
