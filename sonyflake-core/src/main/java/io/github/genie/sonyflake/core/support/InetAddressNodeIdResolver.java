package io.github.genie.sonyflake.core.support;

import io.github.genie.sonyflake.core.log.Log;
import org.jetbrains.annotations.Nullable;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;

/**
 * Derives the node id from the lower 16 bits of the first non-loopback IPv4
 * address, e.g. {@code 192.168.1.2} gives {@code 1 << 8 | 2 = 258}.
 */
public class InetAddressNodeIdResolver implements NodeIdResolver {

    private final Log log = Log.get(InetAddressNodeIdResolver.class);

    private final AddressProvider addressProvider;

    public InetAddressNodeIdResolver() {
        this(InetAddressNodeIdResolver::networkInterfaceAddresses);
    }

    public InetAddressNodeIdResolver(AddressProvider addressProvider) {
        this.addressProvider = addressProvider;
    }

    @Override
    @Nullable
    public Integer resolveNodeId() {
        List<InetAddress> addresses;
        try {
            addresses = addressProvider.getAddresses();
        } catch (SocketException e) {
            log.error("list network interfaces failed", e);
            return null;
        }
        for (InetAddress address : addresses) {
            if (address instanceof Inet4Address && !address.isLoopbackAddress()) {
                int nodeId = nodeIdOf((Inet4Address) address);
                log.debug(() -> "node id " + nodeId + " resolved from " + address.getHostAddress());
                return nodeId;
            }
        }
        log.debug(() -> "no external IPv4 address found");
        return null;
    }

    public static int nodeIdOf(Inet4Address address) {
        byte[] octets = address.getAddress();
        return (octets[2] & 0xFF) << 8 | (octets[3] & 0xFF);
    }

    private static List<InetAddress> networkInterfaceAddresses() throws SocketException {
        Enumeration<NetworkInterface> interfaces = NetworkInterface.getNetworkInterfaces();
        if (interfaces == null) {
            return Collections.emptyList();
        }
        List<InetAddress> result = new ArrayList<>();
        for (NetworkInterface networkInterface : Collections.list(interfaces)) {
            if (networkInterface.isLoopback() || !networkInterface.isUp()) {
                continue;
            }
            result.addAll(Collections.list(networkInterface.getInetAddresses()));
        }
        return result;
    }

    @FunctionalInterface
    public interface AddressProvider {
        List<InetAddress> getAddresses() throws SocketException;
    }

}
