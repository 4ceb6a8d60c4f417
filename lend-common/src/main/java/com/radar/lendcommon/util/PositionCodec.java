package com.radar.lendcommon.util;

import com.radar.lendcommon.entity.Loan;
import com.radar.lendcommon.entity.UserPosition;
import com.radar.lendcommon.enums.LtvTier;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;

/**
 * 借贷账户的定长二进制布局（小端）
 * <pre>
 * version:u8 owner:i64 collateral_balance:u64 debt_asset_balance:u64 loan_count:u64 loans_len:u32
 * loan := id:u64 start_date:i64 principal:u64 apy:u8 collateral:u64 ltv:u8 borrower:i64
 * </pre>
 * 字段顺序不可调整，格式变更必须提升 version 并提供迁移。
 */
public final class PositionCodec {

    public static final byte VERSION = 1;

    private static final int HEADER_BYTES = 1 + 8 + 8 + 8 + 8 + 4;
    private static final int LOAN_BYTES = 8 + 8 + 8 + 1 + 8 + 1 + 8;

    private PositionCodec() {
    }

    public static byte[] encode(UserPosition position) {
        List<Loan> loans = position.getLoans();
        ByteBuffer buf = ByteBuffer.allocate(HEADER_BYTES + LOAN_BYTES * loans.size())
                .order(ByteOrder.LITTLE_ENDIAN);
        buf.put(VERSION);
        buf.putLong(position.getOwnerId());
        buf.putLong(position.getCollateralBalance());
        buf.putLong(position.getDebtAssetBalance());
        buf.putLong(position.getLoanCount());
        buf.putInt(loans.size());
        for (Loan loan : loans) {
            buf.putLong(loan.getLoanId());
            buf.putLong(loan.getStartDate());
            buf.putLong(loan.getPrincipal());
            buf.put(toU8(loan.getApy(), "apy"));
            buf.putLong(loan.getCollateral());
            buf.put(toU8(loan.getLtv(), "ltv"));
            buf.putLong(loan.getBorrowerId());
        }
        return buf.array();
    }

    public static UserPosition decode(byte[] data) {
        ByteBuffer buf = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
        try {
            byte version = buf.get();
            if (version != VERSION) {
                throw new IllegalArgumentException("不支持的账户布局版本: " + version);
            }
            UserPosition position = new UserPosition();
            position.setOwnerId(buf.getLong());
            position.setCollateralBalance(buf.getLong());
            position.setDebtAssetBalance(buf.getLong());
            position.setLoanCount(buf.getLong());
            int size = buf.getInt();
            if (size < 0 || (long) size * LOAN_BYTES != buf.remaining()) {
                throw new IllegalArgumentException("贷款数量与数据长度不符: " + size);
            }
            List<Loan> loans = new ArrayList<>(size);
            for (int i = 0; i < size; i++) {
                Loan loan = new Loan();
                loan.setLoanId(buf.getLong());
                loan.setStartDate(buf.getLong());
                loan.setPrincipal(buf.getLong());
                loan.setApy(Byte.toUnsignedInt(buf.get()));
                loan.setCollateral(buf.getLong());
                loan.setLtv(Byte.toUnsignedInt(buf.get()));
                loan.setBorrowerId(buf.getLong());
                if (!LtvTier.isValidPair(loan.getLtv(), loan.getApy())) {
                    throw new IllegalArgumentException("非法LTV/APY组合: " + loan.getLtv() + "/" + loan.getApy());
                }
                loans.add(loan);
            }
            position.setLoans(loans);
            return position;
        } catch (BufferUnderflowException e) {
            throw new IllegalArgumentException("账户数据被截断", e);
        }
    }

    private static byte toU8(int value, String field) {
        if (value < 0 || value > 0xFF) {
            throw new IllegalArgumentException(field + " 超出u8范围: " + value);
        }
        return (byte) value;
    }
}
