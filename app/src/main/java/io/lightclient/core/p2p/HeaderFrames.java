package io.lightclient.core.p2p;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import io.netty.handler.codec.MessageToMessageCodec;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import io.netty.util.CharsetUtil;

import java.util.List;

/** Length-prefixed UTF-8 JSON framing shared by both ends of the header protocol. */
final class HeaderFrames {
    /** Light blocks carry the full validator set, so frames are larger than chat-sized. */
    static final int MAX_FRAME_BYTES = 1 << 24;

    private HeaderFrames() {
    }

    static void configure(ChannelPipeline pipeline, ObjectMapper mapper) {
        pipeline.addLast(new LengthFieldBasedFrameDecoder(MAX_FRAME_BYTES, 0, 4, 0, 4));
        pipeline.addLast(new LengthFieldPrepender(4));
        pipeline.addLast(new StringDecoder(CharsetUtil.UTF_8));
        pipeline.addLast(new StringEncoder(CharsetUtil.UTF_8));
        pipeline.addLast(new JsonCodec(mapper));
    }

    private static final class JsonCodec extends MessageToMessageCodec<String, HeaderMessage> {
        private final ObjectMapper mapper;

        JsonCodec(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        protected void encode(ChannelHandlerContext ctx, HeaderMessage msg, List<Object> out) throws Exception {
            out.add(mapper.writeValueAsString(msg));
        }

        @Override
        protected void decode(ChannelHandlerContext ctx, String msg, List<Object> out) throws Exception {
            out.add(mapper.readValue(msg, HeaderMessage.class));
        }
    }
}
