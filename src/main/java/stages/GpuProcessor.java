package stages;

import image.PixelBuffer;
import org.jocl.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.jocl.CL.*;

/**
 * Contrast on GPU using JOCL (OpenCL 1.x/2.0).
 * Falls back to the CPU LUT path if no compatible GPU/OpenCL is available.
 *
 * Each RGB channel becomes {@code v * scale + offset}: with scale = factor and
 * offset = mean * (1 - factor) this is the same blend towards the mean luma
 * that {@link FiltersCPUFast#contrastEnhance} computes.
 */
public final class GpuProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(GpuProcessor.class);

    private GpuProcessor() {
    }

    private static final String KERNEL = """
                __kernel void affine(
                    __global uchar4* pixels,
                    const float scale,
                    const float offset)
                {
                    int i = get_global_id(0);
                    uchar4 p = pixels[i];

                    float r = p.x * scale + offset;
                    float g = p.y * scale + offset;
                    float b = p.z * scale + offset;

                    r = clamp(r, 0.0f, 255.0f);
                    g = clamp(g, 0.0f, 255.0f);
                    b = clamp(b, 0.0f, 255.0f);

                    pixels[i] = (uchar4)((uchar)r, (uchar)g, (uchar)b, p.w);
                }
            """;

    public static PixelBuffer contrastEnhance(PixelBuffer src, double factor) {
        try {
            int mean = FiltersCPUFast.meanLuma(src);
            float scale = (float) factor;
            float offset = (float) (mean * (1.0 - factor));
            return runOnGpu(src, scale, offset);
        } catch (Throwable t) {
            LOG.warn("[GPU] Falling back to CPU: {}", t.getMessage());
            return FiltersCPUFast.contrastEnhance(src, factor);
        }
    }

    // ---- JOCL implementation ----
    private static PixelBuffer runOnGpu(PixelBuffer src, float scale, float offset) {
        CL.setExceptionsEnabled(true);

        int[] px = src.pixels();
        int n = px.length;

        // Pack ARGB → RGBA bytes
        byte[] bytes = new byte[n * 4];
        int idx = 0;
        for (int p : px) {
            bytes[idx++] = (byte) ((p >> 16) & 0xFF); // R
            bytes[idx++] = (byte) ((p >> 8) & 0xFF); // G
            bytes[idx++] = (byte) (p & 0xFF); // B
            bytes[idx++] = (byte) ((p >> 24) & 0xFF); // A
        }

        // --- Platform & device ---
        int[] numPlatforms = new int[1];
        clGetPlatformIDs(0, null, numPlatforms);
        if (numPlatforms[0] == 0)
            throw new IllegalStateException("No OpenCL platforms found");

        cl_platform_id[] platforms = new cl_platform_id[numPlatforms[0]];
        clGetPlatformIDs(platforms.length, platforms, null);
        cl_platform_id platform = platforms[0];

        int[] numDevices = new int[1];
        int err = clGetDeviceIDs(platform, CL_DEVICE_TYPE_GPU, 0, null, numDevices);
        if (err != CL_SUCCESS || numDevices[0] == 0)
            throw new IllegalStateException("No OpenCL GPU device found");

        cl_device_id[] devices = new cl_device_id[numDevices[0]];
        clGetDeviceIDs(platform, CL_DEVICE_TYPE_GPU, devices.length, devices, null);
        cl_device_id device = devices[0];

        // --- Context & queue ---
        cl_context_properties props = new cl_context_properties();
        props.addProperty(CL_CONTEXT_PLATFORM, platform);

        cl_context context = clCreateContext(props, 1, new cl_device_id[] { device }, null, null, null);
        cl_queue_properties qprops = new cl_queue_properties();
        cl_command_queue queue = clCreateCommandQueueWithProperties(context, device, qprops, null);

        cl_program program = null;
        cl_kernel kernel = null;
        cl_mem mem = null;
        try {
            // --- Program & kernel ---
            program = clCreateProgramWithSource(context, 1, new String[] { KERNEL }, null, null);
            clBuildProgram(program, 0, null, null, null, null);
            kernel = clCreateKernel(program, "affine", null);

            // --- Device buffer ---
            mem = clCreateBuffer(context,
                    CL_MEM_READ_WRITE | CL_MEM_COPY_HOST_PTR,
                    (long) Sizeof.cl_uchar * bytes.length, Pointer.to(bytes), null);

            clSetKernelArg(kernel, 0, Sizeof.cl_mem, Pointer.to(mem));
            clSetKernelArg(kernel, 1, Sizeof.cl_float, Pointer.to(new float[] { scale }));
            clSetKernelArg(kernel, 2, Sizeof.cl_float, Pointer.to(new float[] { offset }));

            // --- Launch & read back ---
            long[] global = new long[] { n };
            clEnqueueNDRangeKernel(queue, kernel, 1, null, global, null, 0, null, null);
            clEnqueueReadBuffer(queue, mem, CL_TRUE, 0,
                    (long) Sizeof.cl_uchar * bytes.length, Pointer.to(bytes), 0, null, null);
        } finally {
            if (mem != null)
                clReleaseMemObject(mem);
            if (kernel != null)
                clReleaseKernel(kernel);
            if (program != null)
                clReleaseProgram(program);
            clReleaseCommandQueue(queue);
            clReleaseContext(context);
        }

        // Unpack RGBA → ARGB
        int[] out = new int[n];
        idx = 0;
        for (int i = 0; i < n; i++) {
            int r = bytes[idx++] & 0xFF;
            int g = bytes[idx++] & 0xFF;
            int b = bytes[idx++] & 0xFF;
            int a = bytes[idx++] & 0xFF;
            out[i] = (a << 24) | (r << 16) | (g << 8) | b;
        }
        return PixelBuffer.of(src.width(), src.height(), src.mode(), out);
    }
}
