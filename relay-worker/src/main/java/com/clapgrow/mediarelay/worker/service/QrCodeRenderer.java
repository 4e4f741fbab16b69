package com.clapgrow.mediarelay.worker.service;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.EncodeHintType;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.QRCodeWriter;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;
import java.util.Map;

/**
 * Renders a QR challenge payload to a PNG data URL the dashboard can show as-is.
 */
@Component
public class QrCodeRenderer {
    
    private static final int SIZE_PX = 264;
    private static final String DATA_URL_PREFIX = "data:image/png;base64,";
    
    /**
     * @param payload Raw QR challenge from the engine
     * @return {@code data:image/png;base64,...}
     * @throws IllegalArgumentException if the payload is blank
     * @throws IllegalStateException if encoding fails
     */
    public String toDataUrl(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new IllegalArgumentException("QR payload cannot be null or empty");
        }
        try {
            BitMatrix matrix = new QRCodeWriter().encode(payload, BarcodeFormat.QR_CODE, SIZE_PX, SIZE_PX,
                Map.of(EncodeHintType.MARGIN, 2));
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            MatrixToImageWriter.writeToStream(matrix, "PNG", out);
            return DATA_URL_PREFIX + Base64.getEncoder().encodeToString(out.toByteArray());
        } catch (WriterException | IOException e) {
            throw new IllegalStateException("Failed to render QR code: " + e.getMessage(), e);
        }
    }
}
