package com.questrail.taskbroker.protocol;

import com.questrail.taskbroker.protocol.codec.WireFrameDecoder;
import com.questrail.taskbroker.protocol.codec.WireFrameEncoder;
import com.questrail.taskbroker.protocol.codec.impl.DefaultWireFrameDecoder;
import com.questrail.taskbroker.protocol.codec.impl.DefaultWireFrameEncoder;
import com.questrail.taskbroker.protocol.internal.decode.BrokerMessageDecoder;
import com.questrail.taskbroker.protocol.internal.encode.BrokerMessageEncoder;
import com.questrail.taskbroker.protocol.internal.frame.WireFrame;
import com.questrail.taskbroker.protocol.model.BrokerMessage;

import java.util.Objects;
import java.util.Optional;

/**
 * LineCodec
 * =============================================================================
 * The complete, symmetric codec pipeline used by sessions.
 *
 * <pre>
 *   inbound:  String → WireFrameDecoder → WireFrame → BrokerMessageDecoder → BrokerMessage
 *   outbound: BrokerMessage → BrokerMessageEncoder → WireFrame → WireFrameEncoder → String
 * </pre>
 *
 * <p>Stateless and thread-safe; one instance is shared by every session.</p>
 */
public final class LineCodec
{
    private final WireFrameDecoder frameDecoder;
    private final WireFrameEncoder frameEncoder;
    private final BrokerMessageDecoder messageDecoder;
    private final BrokerMessageEncoder messageEncoder;

    public LineCodec(WireFrameDecoder frameDecoder,
                     WireFrameEncoder frameEncoder,
                     BrokerMessageDecoder messageDecoder,
                     BrokerMessageEncoder messageEncoder) {
        this.frameDecoder = Objects.requireNonNull(frameDecoder, "frameDecoder");
        this.frameEncoder = Objects.requireNonNull(frameEncoder, "frameEncoder");
        this.messageDecoder = Objects.requireNonNull(messageDecoder, "messageDecoder");
        this.messageEncoder = Objects.requireNonNull(messageEncoder, "messageEncoder");
    }

    /**
     * Codec wired with the default line implementations.
     */
    public static LineCodec standard() {
        return new LineCodec(
                new DefaultWireFrameDecoder(),
                new DefaultWireFrameEncoder(),
                new BrokerMessageDecoder(),
                new BrokerMessageEncoder()
        );
    }

    /**
     * Decode one inbound line.
     *
     * @throws ProtocolException if the line cannot be framed or decoded
     */
    public BrokerMessage decode(String line) {
        Optional<WireFrame> frame = frameDecoder.decode(line);
        if (frame.isEmpty()) {
            throw new ProtocolException("Unframeable line: " + abbreviate(line));
        }
        return messageDecoder.decode(frame.get());
    }

    /**
     * Encode one outbound message, including the line terminator.
     *
     * @throws ProtocolException if a field cannot be represented on the wire
     */
    public String encode(BrokerMessage message) {
        return frameEncoder.encode(messageEncoder.encode(message));
    }

    /**
     * Shortened, single-line form of {@code line} for log and event messages.
     */
    public static String abbreviate(String line) {
        if (line == null) {
            return "<null>";
        }
        String stripped = line.strip();
        return stripped.length() <= 64 ? stripped : stripped.substring(0, 64) + "...";
    }
}
