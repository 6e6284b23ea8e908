/**
** -----------------------------------------------------------------------------**
** CRFHistograms.java
**
** Histograms of device codes used for camera response estimation
**
**
** Copyright (C) 2014 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  CRFHistograms.java is free software: you can redistribute it and/or modify
**  it under the terms of the GNU General Public License as published by
**  the Free Software Foundation, either version 3 of the License, or
**  (at your option) any later version.
**
**  This program is distributed in the hope that it will be useful,
**  but WITHOUT ANY WARRANTY; without even the implied warranty of
**  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
**  GNU General Public License for more details.
**
**  You should have received a copy of the GNU General Public License
**  along with this program.  If not, see <http://www.gnu.org/licenses/>.
** -----------------------------------------------------------------------------**
**
*/

import ij.IJ;
import ij.ImageStack;

import java.util.concurrent.atomic.AtomicInteger;

public class CRFHistograms {
	public static final int BINS=256;

	/**
	 * Normalized cumulative histograms of every channel of every exposure. Each
	 * (channel, exposure) pair is a separate task, so threads never share bins.
	 * @param exposureStack source images
	 * @param threadsMax maximal number of threads to use
	 * @return [channel][exposure][bin], ascending, last bin is 1.0 (all zeros for an empty image)
	 */
	public static float [][][] cumulativeHistograms(
			final ExposureStack exposureStack,
			final int threadsMax){
		final int numChannels= exposureStack.getNumChannels();
		final int numExposures=exposureStack.getNumExposures();
		final float [][][] cumulative=new float[numChannels][numExposures][];
		final int numTasks=numChannels*numExposures;
		final Thread[] threads = newThreadArray(Math.min(threadsMax, numTasks));
		final AtomicInteger ai = new AtomicInteger(0);
		for (int ithread = 0; ithread < threads.length; ithread++) {
			threads[ithread] = new Thread() {
				public void run() {
					for (int nTask = ai.getAndIncrement(); nTask < numTasks; nTask = ai.getAndIncrement()) {
						int chn= nTask/numExposures;
						int nExp=nTask%numExposures;
						cumulative[chn][nExp]=cumulativeHistogram(exposureStack.getPixels(chn, nExp));
					}
				}
			};
		}
		startAndJoin(threads);
		return cumulative;
	}

	/**
	 * Normalized cumulative histogram of 8-bit codes of the pixels
	 * @param pixels values nominally in [0,1]
	 * @return 256 ascending values, last one is 1.0
	 */
	public static float [] cumulativeHistogram(float [] pixels){
		long [] hist=new long[BINS];
		for (int i=0;i<pixels.length;i++) hist[ExposureStack.toCode(pixels[i])]++;
		float [] cumulative=new float[BINS];
		if (pixels.length==0) return cumulative;
		long sum=0;
		for (int i=0;i<BINS;i++){
			sum+=hist[i];
			cumulative[i]=(float) (((double) sum)/pixels.length);
		}
		return cumulative;
	}

	/**
	 * Joint histograms of codes of two registered images of the same scene
	 * @param rowStack channels of the image that selects histogram row (RAW)
	 * @param columnStack channels of the image that selects histogram column (JPEG)
	 * @param threadsMax maximal number of threads to use
	 * @return [channel][row code][column code] occurrence counts
	 */
	public static int [][][] jointHistograms(
			final ImageStack rowStack,
			final ImageStack columnStack,
			final int threadsMax){
		final int numChannels=rowStack.getSize();
		final int [][][] joint=new int[numChannels][BINS][BINS];
		final Thread[] threads = newThreadArray(Math.min(threadsMax, numChannels));
		final AtomicInteger ai = new AtomicInteger(0);
		for (int ithread = 0; ithread < threads.length; ithread++) {
			threads[ithread] = new Thread() {
				public void run() {
					for (int chn = ai.getAndIncrement(); chn < numChannels; chn = ai.getAndIncrement()) {
						float [] rowPixels=   (float []) rowStack.getPixels(chn+1);
						float [] columnPixels=(float []) columnStack.getPixels(chn+1);
						int [][] hist=joint[chn];
						for (int i=0;i<rowPixels.length;i++){
							hist[ExposureStack.toCode(rowPixels[i])][ExposureStack.toCode(columnPixels[i])]++;
						}
						IJ.showStatus("Joint histogram of channel "+(chn+1)+" of "+numChannels+" done");
					}
				}
			};
		}
		startAndJoin(threads);
		return joint;
	}

	/* Create a Thread[] array as large as the number of processors available.
	 * From Stephan Preibisch's Multithreading.java class. See:
	 * http://repo.or.cz/w/trakem2.git?a=blob;f=mpi/fruitfly/general/MultiThreading.java;hb=HEAD
	 */
	static Thread[] newThreadArray(int maxCPUs) {
		int n_cpus = Runtime.getRuntime().availableProcessors();
		if (n_cpus>maxCPUs)n_cpus=maxCPUs;
		if (n_cpus<1) n_cpus=1;
		return new Thread[n_cpus];
	}
	/* Start all given threads and wait on each of them until all are done.
	 * From Stephan Preibisch's Multithreading.java class. See:
	 * http://repo.or.cz/w/trakem2.git?a=blob;f=mpi/fruitfly/general/MultiThreading.java;hb=HEAD
	 */
	static void startAndJoin(Thread[] threads)
	{
		for (int ithread = 0; ithread < threads.length; ++ithread)
		{
			threads[ithread].setPriority(Thread.NORM_PRIORITY);
			threads[ithread].start();
		}

		try
		{
			for (int ithread = 0; ithread < threads.length; ++ithread)
				threads[ithread].join();
		} catch (InterruptedException ie)
		{
			throw new RuntimeException(ie);
		}
	}
}
