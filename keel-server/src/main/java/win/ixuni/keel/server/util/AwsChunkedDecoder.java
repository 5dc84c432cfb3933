package win.ixuni.keel.server.util;

import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import reactor.core.publisher.Flux;
import win.ixuni.keel.core.exception.InvalidArgumentException;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * AWS S3 Chunked Transfer Encoding 解码器
 * <p>
 * Request bodies sent with {@code x-amz-content-sha256: STREAMING-...} look like:
 *
 * <pre>
 * &lt;chunk-size-hex&gt;[;chunk-signature=&lt;signature&gt;]\r\n
 * &lt;chunk-data&gt;\r\n
 * ...
 * 0[;chunk-signature=&lt;final-signature&gt;]\r\n
 * [&lt;trailer-header&gt;\r\n ...]
 * \r\n
 * </pre>
 * <p>
 * 本解码器剥离 chunk headers、signatures 和 trailers，只返回实际数据。
 * Malformed framing is rejected with InvalidArgument.
 */
public final class AwsChunkedDecoder {

    private static final String STREAMING_PREFIX = "STREAMING-";

    private AwsChunkedDecoder() {
    }

    /**
     * @param contentSha256 x-amz-content-sha256 header 值
     * @return true 如果是 AWS Chunked Encoding
     */
    public static boolean isAwsChunkedEncoding(String contentSha256) {
        return contentSha256 != null && contentSha256.startsWith(STREAMING_PREFIX);
    }

    /**
     * 解码 AWS Chunked Encoded 流
     *
     * @param input 原始 DataBuffer 流
     * @return 解码后的 ByteBuffer 流
     */
    public static Flux<ByteBuffer> decode(Flux<DataBuffer> input) {
        return input
                .reduce(new ByteArrayOutputStream(), (baos, dataBuffer) -> {
                    byte[] bytes = new byte[dataBuffer.readableByteCount()];
                    dataBuffer.read(bytes);
                    DataBufferUtils.release(dataBuffer);
                    baos.write(bytes, 0, bytes.length);
                    return baos;
                })
                .flatMapIterable(baos -> decodeChunkedData(baos.toByteArray()));
    }

    /**
     * @param data 原始 chunked 编码数据
     * @return 解码后的数据块列表
     */
    static List<ByteBuffer> decodeChunkedData(byte[] data) {
        List<ByteBuffer> result = new ArrayList<>();
        int pos = 0;

        while (pos < data.length) {
            int headerEnd = findCRLF(data, pos);
            if (headerEnd == -1) {
                throw new InvalidArgumentException("Truncated aws-chunked body: missing chunk header terminator");
            }

            String headerLine = new String(data, pos, headerEnd - pos, StandardCharsets.US_ASCII);
            if (headerLine.isBlank()) {
                // Stray CRLF between chunks
                pos = headerEnd + 2;
                continue;
            }

            int chunkSize = parseChunkSize(headerLine);
            if (chunkSize == 0) {
                // Final chunk; whatever follows is trailer headers
                return result;
            }

            int dataStart = headerEnd + 2;
            if (chunkSize > data.length - dataStart) {
                throw new InvalidArgumentException("Truncated aws-chunked body: chunk of " + chunkSize
                        + " bytes has only " + (data.length - dataStart) + " bytes");
            }
            byte[] chunkData = new byte[chunkSize];
            System.arraycopy(data, dataStart, chunkData, 0, chunkSize);
            result.add(ByteBuffer.wrap(chunkData));

            pos = dataStart + chunkSize + 2;
        }

        throw new InvalidArgumentException("Truncated aws-chunked body: missing final chunk");
    }

    /**
     * @param headerLine chunk header 行，格式: &lt;size-hex&gt;;chunk-signature=...
     */
    private static int parseChunkSize(String headerLine) {
        int semicolonPos = headerLine.indexOf(';');
        String sizeHex = (semicolonPos >= 0 ? headerLine.substring(0, semicolonPos) : headerLine).trim();
        int size;
        try {
            size = Integer.parseInt(sizeHex, 16);
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException("Invalid aws-chunked size header: " + headerLine);
        }
        if (size < 0) {
            throw new InvalidArgumentException("Invalid aws-chunked size header: " + headerLine);
        }
        return size;
    }

    private static int findCRLF(byte[] data, int offset) {
        for (int i = offset; i < data.length - 1; i++) {
            if (data[i] == '\r' && data[i + 1] == '\n') {
                return i;
            }
        }
        return -1;
    }
}
