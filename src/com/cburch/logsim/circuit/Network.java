package com.cburch.logsim.circuit;

import com.cburch.logsim.comp.auxiliary.InputPin;
import com.cburch.logsim.comp.auxiliary.OutputPin;
import com.cburch.logsim.comp.auxiliary.PinRef;
import com.cburch.logsim.comp.impl.Device;
import com.cburch.logsim.comp.impl.DeviceState;
import com.cburch.logsim.comp.specs.DeviceKind;
import com.cburch.logsim.data.Name;
import com.cburch.logsim.data.SymbolTable;
import com.cburch.logsim.file.ErrorType;

import java.util.*;

/**
 * Owns every device and wire of one definition. Devices keep their
 * declaration order.
 */
public final class Network {
    private final SymbolTable symbols;
    private final Map<Name, Device> devices = new LinkedHashMap<>();
    private final List<Connection> connections = new ArrayList<>();
    // salida -> entradas que alimenta (fan-out)
    private final Map<OutputPin, List<InputPin>> fanOut = new HashMap<>();

    public Network(SymbolTable symbols) {
        this.symbols = Objects.requireNonNull(symbols);
    }

    public SymbolTable symbols() {
        return symbols;
    }

    /* ===== Dispositivos ===== */

    public void addDevice(Device device) throws NetworkException {
        Objects.requireNonNull(device, "device");
        if (devices.containsKey(device.name())) {
            throw new NetworkException(ErrorType.DUPLICATE_DEVICE, device.name());
        }
        devices.put(device.name(), device);
    }

    public Optional<Device> device(Name name) {
        return Optional.ofNullable(name == null ? null : devices.get(name));
    }

    public Optional<Device> device(String name) {
        return symbols.query(name).flatMap(this::device);
    }

    public List<Device> devices() {
        return List.copyOf(devices.values());
    }

    public int size() {
        return devices.size();
    }

    public List<Device> devicesOfKind(DeviceKind kind) {
        List<Device> out = new ArrayList<>();
        for (Device d : devices.values()) if (d.kind() == kind) out.add(d);
        return out;
    }

    /** Every output pin, in device order. */
    public List<OutputPin> outputPins() {
        List<OutputPin> out = new ArrayList<>();
        for (Device d : devices.values()) out.addAll(d.outputs());
        return out;
    }

    /* ===== Resolución de pines ===== */

    /**
     * Resolves the driving end of a wire.
     *
     * @throws NetworkException if the device or pin does not exist, or the pin is an input
     */
    public OutputPin resolveSource(PinRef ref) throws NetworkException {
        Device d = requireDevice(ref.device());
        Optional<OutputPin> out = d.output(ref.pin());
        if (out.isPresent()) return out.get();

        if (!ref.isQualified()) throw new NetworkException(ErrorType.PIN_REQUIRED, ref.device());
        if (d.input(ref.pin()).isPresent()) throw new NetworkException(ErrorType.INPUT_AS_SOURCE, ref);
        throw new NetworkException(ErrorType.UNKNOWN_PIN, ref.device(), ref.pin());
    }

    /**
     * Resolves the driven end of a wire.
     *
     * @throws NetworkException if the device or pin does not exist, or the pin is an output
     */
    public InputPin resolveDestination(PinRef ref) throws NetworkException {
        Device d = requireDevice(ref.device());
        Optional<InputPin> in = d.input(ref.pin());
        if (in.isPresent()) return in.get();

        // Fuentes (SWITCH, CLOCK, SIGGEN) no tienen entradas
        if (d.inputs().isEmpty()) throw new NetworkException(ErrorType.OUTPUT_AS_DESTINATION, ref);
        if (!ref.isQualified()) throw new NetworkException(ErrorType.PIN_REQUIRED, ref.device());
        if (d.output(ref.pin()).isPresent()) throw new NetworkException(ErrorType.OUTPUT_AS_DESTINATION, ref);
        throw new NetworkException(ErrorType.UNKNOWN_PIN, ref.device(), ref.pin());
    }

    /** Resolves a monitor point: the pin must be an output. */
    public OutputPin resolveOutput(PinRef ref) throws NetworkException {
        Device d = requireDevice(ref.device());
        Optional<OutputPin> out = d.output(ref.pin());
        if (out.isPresent()) return out.get();
        if (!ref.isQualified()) throw new NetworkException(ErrorType.PIN_REQUIRED, ref.device());
        if (d.input(ref.pin()).isPresent()) throw new NetworkException(ErrorType.MONITOR_NOT_OUTPUT, ref);
        throw new NetworkException(ErrorType.UNKNOWN_PIN, ref.device(), ref.pin());
    }

    private Device requireDevice(Name name) throws NetworkException {
        Device d = devices.get(name);
        if (d == null) throw new NetworkException(ErrorType.UNDEFINED_DEVICE, name);
        return d;
    }

    /* ===== Conexiones ===== */

    /**
     * Wires {@code from} to {@code to}. Nothing changes if any check fails.
     */
    public Connection connect(PinRef from, PinRef to) throws NetworkException {
        OutputPin src = resolveSource(from);
        InputPin dst = resolveDestination(to);
        if (dst.isBound()) throw new NetworkException(ErrorType.INPUT_ALREADY_CONNECTED, dst.ref());

        dst.bind(src);
        Connection c = new Connection(src, dst);
        connections.add(c);
        fanOut.computeIfAbsent(src, k -> new ArrayList<>()).add(dst);
        return c;
    }

    public List<Connection> connections() {
        return List.copyOf(connections);
    }

    public List<InputPin> fanOut(OutputPin pin) {
        return List.copyOf(fanOut.getOrDefault(pin, List.of()));
    }

    public List<InputPin> unboundInputs() {
        List<InputPin> out = new ArrayList<>();
        for (Device d : devices.values()) {
            for (InputPin in : d.inputs()) if (!in.isBound()) out.add(in);
        }
        return out;
    }

    /** @return true si todas las entradas están conectadas */
    public boolean isComplete() {
        return unboundInputs().isEmpty();
    }

    /* ===== Estado ===== */

    /** Power-on state for every device. */
    public void reset() {
        for (Device d : devices.values()) d.reset();
    }

    public Map<Device, DeviceState> saveState() {
        Map<Device, DeviceState> out = new LinkedHashMap<>();
        for (Device d : devices.values()) out.put(d, d.saveState());
        return out;
    }

    public void restoreState(Map<Device, DeviceState> state) {
        state.forEach(Device::restoreState);
    }

    @Override
    public String toString() {
        return "Network{devices=" + devices.size() + ", connections=" + connections.size() + "}";
    }
}
