package com.project.raster.segmentation.io;

import java.awt.image.DataBuffer;

/**
 * Sample data type of a source raster.
 */
public enum RasterDataType {
    UINT8(DataBuffer.TYPE_BYTE, false),
    UINT16(DataBuffer.TYPE_USHORT, false),
    INT16(DataBuffer.TYPE_SHORT, false),
    INT32(DataBuffer.TYPE_INT, false),
    FLOAT32(DataBuffer.TYPE_FLOAT, true),
    FLOAT64(DataBuffer.TYPE_DOUBLE, true);

    private final int dataBufferType;
    private final boolean floatingPoint;

    RasterDataType(int dataBufferType, boolean floatingPoint) {
        this.dataBufferType = dataBufferType;
        this.floatingPoint = floatingPoint;
    }

    public boolean isFloatingPoint() {
        return floatingPoint;
    }

    public static RasterDataType fromDataBufferType(int type) {
        for (RasterDataType t : values()) {
            if (t.dataBufferType == type) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unsupported sample data type: " + type);
    }
}
