package hidropluvial.physics.tc;

import hidropluvial.domain.tc.ChannelFlowSegment;
import hidropluvial.domain.tc.FlowSegment;
import hidropluvial.domain.tc.ShallowFlowSegment;
import hidropluvial.domain.tc.ShallowSurface;
import hidropluvial.domain.tc.SheetFlowSegment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Método de velocidades NRCS (TR-55). El Tc es la suma de los tiempos de viaje de
 * cada tramo: laminar, concentrado superficial y en canal.
 * <p>
 * Stateless y Thread-Safe.
 */
public final class NrcsVelocitySolver {

    public static final double DEFAULT_P2_MM = 50.0;

    private static final double FT_PER_M = 3.28084;
    private static final double MM_PER_IN = 25.4;

    private NrcsVelocitySolver() {
        throw new IllegalStateException("Prohibido construir esta clase utilidad");
    }

    /**
     * Tiempo de viaje (h) de un tramo, para el desglose.
     */
    public record SegmentTime(FlowSegment segment, double travelTimeHr) {
    }

    /**
     * Flujo laminar: {@code Tt = 0.007 · (n·L)^0.8 / (P2^0.5 · S^0.4)} [h, ft, in].
     */
    public static double sheetFlowTime(double lengthM, double manningN, double slope, double p2Mm) {
        if (lengthM <= 0 || lengthM > SheetFlowSegment.MAX_LENGTH_M) {
            throw new IllegalArgumentException("Longitud de flujo laminar debe ser 0-100 m (recibido " + lengthM + ")");
        }
        EmpiricalTcSolver.requirePositive(manningN, "Coeficiente n");
        EmpiricalTcSolver.requirePositive(slope, "Pendiente");
        EmpiricalTcSolver.requirePositive(p2Mm, "P2");

        double p2In = p2Mm / MM_PER_IN;
        double lengthFt = lengthM * FT_PER_M;
        return 0.007 * Math.pow(manningN * lengthFt, 0.8) / (Math.sqrt(p2In) * Math.pow(slope, 0.4));
    }

    /**
     * Flujo concentrado superficial: {@code V = k·√S}, {@code Tt = L / (3600·V)}.
     */
    public static double shallowFlowTime(double lengthM, double slope, ShallowSurface surface) {
        EmpiricalTcSolver.requirePositive(lengthM, "Longitud");
        EmpiricalTcSolver.requirePositive(slope, "Pendiente");
        ShallowSurface effective = surface == null ? ShallowSurface.UNPAVED : surface;

        double velocity = effective.getVelocityCoefficient() * Math.sqrt(slope);
        return lengthM / (velocity * 3600.0);
    }

    /**
     * Flujo en canal, Manning: {@code V = R^(2/3)·S^(1/2) / n}.
     */
    public static double channelFlowTime(double lengthM, double manningN, double slope, double hydraulicRadiusM) {
        EmpiricalTcSolver.requirePositive(lengthM, "Longitud");
        EmpiricalTcSolver.requirePositive(manningN, "Coeficiente n");
        EmpiricalTcSolver.requirePositive(slope, "Pendiente");
        EmpiricalTcSolver.requirePositive(hydraulicRadiusM, "Radio hidráulico");

        double velocity = Math.pow(hydraulicRadiusM, 2.0 / 3.0) * Math.sqrt(slope) / manningN;
        return lengthM / (velocity * 3600.0);
    }

    public static double travelTime(FlowSegment segment, double defaultP2Mm) {
        switch (segment.type()) {
            case SHEET -> {
                SheetFlowSegment sheet = (SheetFlowSegment) segment;
                double p2 = sheet.p2Mm() != null ? sheet.p2Mm() : defaultP2Mm;
                return sheetFlowTime(sheet.lengthM(), sheet.manningN(), sheet.slope(), p2);
            }
            case SHALLOW -> {
                ShallowFlowSegment shallow = (ShallowFlowSegment) segment;
                return shallowFlowTime(shallow.lengthM(), shallow.slope(), shallow.surface());
            }
            case CHANNEL -> {
                ChannelFlowSegment channel = (ChannelFlowSegment) segment;
                return channelFlowTime(channel.lengthM(), channel.manningN(), channel.slope(), channel.hydraulicRadiusM());
            }
            default -> throw new IllegalArgumentException("Tipo de tramo no soportado: " + segment.type());
        }
    }

    /**
     * Tiempo de viaje de cada tramo, en el orden recibido.
     */
    public static List<SegmentTime> breakdown(List<? extends FlowSegment> segments, double defaultP2Mm) {
        if (segments == null || segments.isEmpty()) {
            return Collections.emptyList();
        }
        List<SegmentTime> times = new ArrayList<>(segments.size());
        for (FlowSegment segment : segments) {
            times.add(new SegmentTime(segment, travelTime(segment, defaultP2Mm)));
        }
        return Collections.unmodifiableList(times);
    }

    /**
     * Tc total en horas. Una lista vacía da 0.
     */
    public static double totalTime(List<? extends FlowSegment> segments, double defaultP2Mm) {
        double total = 0.0;
        for (SegmentTime time : breakdown(segments, defaultP2Mm)) {
            total += time.travelTimeHr();
        }
        return total;
    }

    public static double totalTime(List<? extends FlowSegment> segments) {
        return totalTime(segments, DEFAULT_P2_MM);
    }
}
